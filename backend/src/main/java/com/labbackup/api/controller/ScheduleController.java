package com.labbackup.api.controller;

import com.labbackup.api.engine.ChainDecision;
import com.labbackup.api.model.dto.BackupResponse;
import com.labbackup.api.model.dto.ScheduleRequest;
import com.labbackup.api.model.dto.ScheduleResponse;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.service.BackupService;
import com.labbackup.api.service.ChainService;
import com.labbackup.api.service.ScheduleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
@Tag(name = "Schedules", description = "Backup schedule management")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final BackupService backupService;
    private final ChainService chainService;

    @GetMapping
    @Operation(summary = "List schedules, optionally for one source")
    public ResponseEntity<List<ScheduleResponse>> listSchedules(
            @RequestParam(required = false) String sourceType,
            @RequestParam(required = false) Long sourceId) {
        List<ScheduleResponse> responses = scheduleService.listSchedules(sourceType, sourceId).stream()
                .map(ScheduleResponse::fromEntity)
                .toList();
        return ResponseEntity.ok(responses);
    }

    @PostMapping
    @Operation(summary = "Create a schedule")
    public ResponseEntity<ScheduleResponse> createSchedule(@Valid @RequestBody ScheduleRequest request) {
        BackupSchedule schedule = scheduleService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ScheduleResponse.fromEntity(schedule));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule details")
    public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ScheduleResponse.fromEntity(scheduleService.getSchedule(scheduleId)));
    }

    @PutMapping("/{scheduleId}")
    @Operation(summary = "Update a schedule")
    public ResponseEntity<ScheduleResponse> updateSchedule(
            @PathVariable UUID scheduleId,
            @Valid @RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(ScheduleResponse.fromEntity(scheduleService.updateSchedule(scheduleId, request)));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule (existing backups are kept)")
    public ResponseEntity<Map<String, String>> deleteSchedule(@PathVariable UUID scheduleId) {
        scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(Map.of("message", "Schedule deleted successfully"));
    }

    @PostMapping("/{scheduleId}/trigger")
    @Operation(summary = "Trigger a backup for this schedule now")
    public ResponseEntity<BackupResponse> triggerSchedule(@PathVariable UUID scheduleId) {
        Backup backup = backupService.triggerScheduledBackup(scheduleId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResponse.fromEntity(backup));
    }

    @GetMapping("/{scheduleId}/chain-decision")
    @Operation(summary = "Preview the mode and chain the next trigger would get")
    public ResponseEntity<ChainDecision> previewChainDecision(@PathVariable UUID scheduleId) {
        return ResponseEntity.ok(chainService.buildChainDecision(scheduleService.getSchedule(scheduleId)));
    }
}
