package com.labbackup.api.controller;

import com.labbackup.api.engine.RestorationPlan;
import com.labbackup.api.model.dto.BackupDeletionInfo;
import com.labbackup.api.model.dto.BackupListResponse;
import com.labbackup.api.model.dto.BackupResponse;
import com.labbackup.api.model.dto.ImmutabilityRequest;
import com.labbackup.api.model.dto.LegalHoldRequest;
import com.labbackup.api.model.dto.ManualBackupRequest;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.service.BackupDeletionService;
import com.labbackup.api.service.BackupService;
import com.labbackup.api.service.ProtectionService;
import com.labbackup.api.service.RestorationService;
import com.labbackup.api.service.VerificationService;
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
@RequestMapping("/api/v1/backups")
@RequiredArgsConstructor
@Tag(name = "Backups", description = "Backup lifecycle, restore planning and protection")
public class BackupController {

    private final BackupService backupService;
    private final BackupDeletionService backupDeletionService;
    private final RestorationService restorationService;
    private final ProtectionService protectionService;
    private final VerificationService verificationService;

    @GetMapping
    @Operation(summary = "List backups of a source (excludes deleted by default)")
    public ResponseEntity<BackupListResponse> listBackups(
            @RequestParam String sourceType,
            @RequestParam Long sourceId,
            @RequestParam(defaultValue = "false") boolean includeDeleted) {
        List<Backup> backups = backupService.listBackups(sourceType, sourceId, includeDeleted);
        return ResponseEntity.ok(BackupListResponse.fromEntities(backups));
    }

    @PostMapping
    @Operation(summary = "Create a manual backup")
    public ResponseEntity<BackupResponse> createBackup(@Valid @RequestBody ManualBackupRequest request) {
        Backup backup = backupService.createManualBackup(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BackupResponse.fromEntity(backup));
    }

    @GetMapping("/{backupId}")
    @Operation(summary = "Get backup details")
    public ResponseEntity<BackupResponse> getBackup(@PathVariable UUID backupId) {
        return ResponseEntity.ok(BackupResponse.fromEntity(backupService.getBackup(backupId)));
    }

    @PostMapping("/{backupId}/cancel")
    @Operation(summary = "Cancel a pending or running backup")
    public ResponseEntity<BackupResponse> cancelBackup(@PathVariable UUID backupId) {
        return ResponseEntity.ok(BackupResponse.fromEntity(backupService.cancelBackup(backupId)));
    }

    @GetMapping("/{backupId}/restore-plan")
    @Operation(summary = "Compute the ordered artifact list that restores this backup")
    public ResponseEntity<RestorationPlan> getRestorePlan(@PathVariable UUID backupId) {
        return ResponseEntity.ok(restorationService.planRestoration(backupId));
    }

    @PostMapping("/{backupId}/verify")
    @Operation(summary = "Re-read the stored artifact and check it against the recorded checksum")
    public ResponseEntity<Map<String, String>> verifyBackup(@PathVariable UUID backupId) {
        verificationService.requestVerification(backupId);
        return ResponseEntity.accepted().body(Map.of("message", "Verification started"));
    }

    @GetMapping("/{backupId}/deletion-info")
    @Operation(summary = "Get information about what will be deleted (for confirmation dialog)")
    public ResponseEntity<BackupDeletionInfo> getBackupDeletionInfo(@PathVariable UUID backupId) {
        return ResponseEntity.ok(backupDeletionService.getDeletionInfo(backupId));
    }

    @DeleteMapping("/{backupId}")
    @Operation(summary = "Delete a backup and its dependents (requires confirm=true if it has dependents)")
    public ResponseEntity<Map<String, String>> deleteBackup(
            @PathVariable UUID backupId,
            @RequestParam(defaultValue = "false") boolean confirm) {
        backupDeletionService.deleteBackup(backupId, confirm);
        return ResponseEntity.ok(Map.of("message", "Backup deleted successfully"));
    }

    @PostMapping("/{backupId}/immutable")
    @Operation(summary = "Make a backup immutable until the given instant")
    public ResponseEntity<BackupResponse> makeImmutable(
            @PathVariable UUID backupId,
            @Valid @RequestBody ImmutabilityRequest request) {
        Backup backup = protectionService.makeImmutable(backupId, request.getRetentionUntil());
        return ResponseEntity.ok(BackupResponse.fromEntity(backup));
    }

    @PostMapping("/{backupId}/legal-hold")
    @Operation(summary = "Place a backup under legal hold")
    public ResponseEntity<BackupResponse> enableLegalHold(
            @PathVariable UUID backupId,
            @Valid @RequestBody LegalHoldRequest request) {
        Backup backup = protectionService.enableLegalHold(backupId, request.getReason());
        return ResponseEntity.ok(BackupResponse.fromEntity(backup));
    }
}
