package com.labbackup.api.controller;

import com.labbackup.api.model.dto.BackupListResponse;
import com.labbackup.api.model.dto.RetentionPreviewResponse;
import com.labbackup.api.model.dto.RetentionSweepResult;
import com.labbackup.api.model.entity.RetentionConfig;
import com.labbackup.api.service.BackupService;
import com.labbackup.api.service.ChainService;
import com.labbackup.api.service.RetentionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/sources/{sourceType}/{sourceId}")
@RequiredArgsConstructor
@Tag(name = "Sources", description = "Per-source chains and retention")
public class SourceController {

    private final RetentionService retentionService;
    private final ChainService chainService;

    @GetMapping("/chains")
    @Operation(summary = "List chain ids of a source")
    public ResponseEntity<List<UUID>> listChains(@PathVariable String sourceType, @PathVariable Long sourceId) {
        BackupService.validateSourceType(sourceType);
        return ResponseEntity.ok(chainService.listChainIds(sourceType, sourceId));
    }

    @GetMapping("/orphans")
    @Operation(summary = "List completed backups whose parent no longer exists")
    public ResponseEntity<BackupListResponse> listOrphans(@PathVariable String sourceType, @PathVariable Long sourceId) {
        BackupService.validateSourceType(sourceType);
        return ResponseEntity.ok(BackupListResponse.fromEntities(chainService.findOrphanedBackups(sourceType, sourceId)));
    }

    /**
     * Dry run of the retention policy. Tier counts that are not given come from the source's
     * effective config.
     */
    @GetMapping("/retention")
    @Operation(summary = "Preview which backups retention would keep and delete")
    public ResponseEntity<RetentionPreviewResponse> previewRetention(
            @PathVariable String sourceType,
            @PathVariable Long sourceId,
            @RequestParam(required = false) Integer daily,
            @RequestParam(required = false) Integer weekly,
            @RequestParam(required = false) Integer monthly,
            @RequestParam(required = false) Integer yearly) {
        BackupService.validateSourceType(sourceType);
        RetentionConfig base = retentionService.effectiveConfig(sourceType, sourceId);
        RetentionConfig config = RetentionConfig.of(
                daily != null ? daily : base.getDaily(),
                weekly != null ? weekly : base.getWeekly(),
                monthly != null ? monthly : base.getMonthly(),
                yearly != null ? yearly : base.getYearly());
        config.validate();

        return ResponseEntity.ok(RetentionPreviewResponse.from(sourceType, sourceId, config,
                retentionService.evaluateRetention(sourceType, sourceId, config)));
    }

    @PostMapping("/retention/sweep")
    @Operation(summary = "Apply the retention policy now")
    public ResponseEntity<RetentionSweepResult> sweep(@PathVariable String sourceType, @PathVariable Long sourceId) {
        BackupService.validateSourceType(sourceType);
        return ResponseEntity.ok(retentionService.sweepSource(sourceType, sourceId));
    }
}
