package com.labbackup.api.service;

import com.labbackup.api.engine.ChainDecision;
import com.labbackup.api.engine.ChainPolicy;
import com.labbackup.api.event.BackupCreatedEvent;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.exception.BackupInProgressException;
import com.labbackup.api.exception.SnapshotCaptureFailedException;
import com.labbackup.api.model.dto.ManualBackupRequest;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.repository.BackupScheduleRepository;
import com.labbackup.api.service.snapshot.CaptureResult;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.snapshot.SnapshotSource;
import com.labbackup.api.service.storage.StorageGateway;
import com.labbackup.api.service.storage.StoredObject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates backups with their chain identity and runs the capture and upload.
 * <p>
 * Chain identity is assigned while holding the source lock, in the same transaction that inserts
 * the pending row. Capture and upload run after commit on the async executor and hold no lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupService {

    private static final List<String> IN_FLIGHT_STATUSES = List.of(Backup.STATUS_PENDING, Backup.STATUS_RUNNING);
    private static final int COMPLETE_ATTEMPTS = 3;

    private final BackupRepository backupRepository;
    private final BackupScheduleRepository scheduleRepository;
    private final ChainService chainService;
    private final SourceLockService sourceLockService;
    private final SnapshotProducer snapshotProducer;
    private final StorageGateway storageGateway;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Create the next backup for a schedule.
     */
    @Transactional
    public Backup triggerScheduledBackup(UUID scheduleId) {
        BackupSchedule schedule = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> ApiException.notFound("Schedule", scheduleId));

        return createBackup(ChainPolicy.fromSchedule(schedule), ChainService.sourceFor(schedule),
                schedule.getStorageBackendId());
    }

    /**
     * Create a backup outside any schedule.
     */
    @Transactional
    public Backup createManualBackup(ManualBackupRequest request) {
        ChainPolicy policy = manualPolicy(request.getBackupMode());
        SnapshotSource source = SnapshotSource.builder()
                .sourceType(request.getSourceType())
                .sourceId(request.getSourceId())
                .build();
        return createBackup(policy, source, request.getStorageBackendId());
    }

    /**
     * Assign chain identity and insert the pending row under the source lock.
     *
     * @throws BackupInProgressException if the source already has a pending or running backup
     */
    @Transactional
    public Backup createBackup(ChainPolicy policy, SnapshotSource source, Long storageBackendId) {
        validateSourceType(source.getSourceType());
        if (source.getSourceId() == null) {
            throw new IllegalArgumentException("Source id is required");
        }
        if (storageBackendId == null) {
            throw new IllegalArgumentException("Storage backend id is required");
        }

        sourceLockService.ensureLockRow(source.getSourceType(), source.getSourceId());
        sourceLockService.acquire(source.getSourceType(), source.getSourceId());

        // Check for pending or running backups so two triggers never derive the same sequence
        List<Backup> active = backupRepository.findBySourceTypeAndSourceIdAndStatusIn(
                source.getSourceType(), source.getSourceId(), IN_FLIGHT_STATUSES);
        if (!active.isEmpty()) {
            throw new BackupInProgressException(source.getSourceType(), source.getSourceId(), active.get(0).getId());
        }

        ChainDecision decision = chainService.decide(policy, source);

        Backup backup = Backup.builder()
                .sourceType(source.getSourceType())
                .sourceId(source.getSourceId())
                .scheduleId(source.getScheduleId())
                .chainId(decision.getChainId())
                .sequenceNumber(decision.getSequenceNumber())
                .parentBackupId(decision.getParentBackupId())
                .backupMode(decision.getBackupMode())
                .modeReason(decision.getReason())
                .storageBackendId(storageBackendId)
                .status(Backup.STATUS_PENDING)
                .build();

        backup = backupRepository.save(backup);
        log.info("Created {} backup {} for {} {} (chain {}, sequence {}, reason {})",
                backup.getBackupMode(), backup.getId(), backup.getSourceType(), backup.getSourceId(),
                backup.getChainId(), backup.getSequenceNumber(), backup.getModeReason());

        // Publish event to trigger async capture after transaction commits
        eventPublisher.publishEvent(new BackupCreatedEvent(this, backup.getId()));

        return backup;
    }

    private ChainPolicy manualPolicy(String backupMode) {
        if (backupMode == null || backupMode.isBlank()) {
            return ChainPolicy.builder().build();
        }
        return switch (backupMode.toLowerCase().trim()) {
            case "auto" -> ChainPolicy.builder().build();
            case "full" -> ChainPolicy.builder().forceFull(true).build();
            case "incr", "incremental" -> ChainPolicy.builder()
                    .backupModePolicy(BackupSchedule.POLICY_INCREMENTAL_PREFERRED)
                    .build();
            default -> throw new IllegalArgumentException(
                    "Invalid backup mode: " + backupMode + ". Valid modes: auto, full, incremental");
        };
    }

    public static void validateSourceType(String sourceType) {
        if (!Backup.SOURCE_VM.equals(sourceType) && !Backup.SOURCE_CONTAINER.equals(sourceType)) {
            throw new IllegalArgumentException("Invalid source type: " + sourceType + ". Valid types: vm, container");
        }
    }

    /**
     * Execute backup asynchronously
     */
    @Async
    public void executeBackupAsync(UUID backupId) {
        try {
            executeBackup(backupId);
        } catch (Exception e) {
            log.error("Failed to execute backup {}: {}", backupId, e.getMessage(), e);
            markBackupFailed(backupId, e.getMessage());
        }
    }

    /**
     * Capture, upload and complete a pending backup. Status is re-read before completing, so a
     * backup cancelled meanwhile ends up cancelled and its uploaded artifact is discarded.
     */
    public void executeBackup(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));

        if (!Backup.STATUS_PENDING.equals(backup.getStatus())) {
            log.info("Backup {} is {}, skipping execution", backupId, backup.getStatus());
            return;
        }

        backup.setStatus(Backup.STATUS_RUNNING);
        backup.setStartedAt(Instant.now());
        try {
            backup = backupRepository.save(backup);
        } catch (ObjectOptimisticLockingFailureException e) {
            log.info("Backup {} changed before it started, skipping execution", backupId);
            return;
        }
        log.info("Starting {} capture for {} {} (backup {}, sequence {})", backup.getBackupMode(),
                backup.getSourceType(), backup.getSourceId(), backupId, backup.getSequenceNumber());

        CaptureResult capture;
        try {
            capture = snapshotProducer.capture(sourceForBackup(backup), backup.getBackupMode(),
                    parentCheckpointToken(backup));
            if (capture == null || capture.getArtifact() == null) {
                throw new SnapshotCaptureFailedException("Snapshot producer returned no artifact");
            }
        } catch (RuntimeException e) {
            log.error("Snapshot capture failed for backup {}: {}", backupId, e.getMessage(), e);
            markBackupFailed(backupId, "Snapshot capture failed: " + e.getMessage());
            return;
        }

        if (isCancelled(backupId)) {
            log.info("Backup {} was cancelled during capture, skipping upload", backupId);
            return;
        }

        String path = storagePath(backup);
        StoredObject stored;
        try {
            stored = storageGateway.put(backup.getStorageBackendId(), path, capture.getArtifact(),
                    capture.getSizeBytes(), metadataFor(backup));
        } catch (RuntimeException e) {
            log.error("Upload failed for backup {}: {}", backupId, e.getMessage(), e);
            markBackupFailed(backupId, "Upload failed: " + e.getMessage());
            return;
        }

        Backup completed = completeBackup(backupId, path, capture, stored);
        if (completed == null) {
            log.info("Backup {} was cancelled during upload, discarding artifact {}", backupId, path);
            discardArtifact(backup.getStorageBackendId(), path);
            return;
        }

        log.info("Backup {} completed. Mode: {}, Chain: {}, Sequence: {}, Size: {} bytes",
                backupId, completed.getBackupMode(), completed.getChainId(),
                completed.getSequenceNumber(), completed.getSizeBytes());
        recordScheduleState(completed);
    }

    /**
     * Moves a running backup to completed. Returns null when it is no longer running.
     */
    private Backup completeBackup(UUID backupId, String path, CaptureResult capture, StoredObject stored) {
        for (int attempt = 1; attempt <= COMPLETE_ATTEMPTS; attempt++) {
            Backup current = backupRepository.findById(backupId).orElse(null);
            if (current == null || !Backup.STATUS_RUNNING.equals(current.getStatus())) {
                return null;
            }

            current.setStatus(Backup.STATUS_COMPLETED);
            current.setCompletedAt(Instant.now());
            current.setStoragePath(path);
            current.setSizeBytes(capture.getSizeBytes());
            current.setCompressedSizeBytes(stored.getSizeBytes());
            current.setChecksum(stored.getChecksum() != null ? stored.getChecksum() : capture.getChecksum());
            current.setCheckpointToken(capture.getNewCheckpointToken());
            try {
                return backupRepository.save(current);
            } catch (ObjectOptimisticLockingFailureException e) {
                log.debug("Backup {} updated concurrently, re-reading (attempt {})", backupId, attempt);
            }
        }
        markBackupFailed(backupId, "Could not record completion after " + COMPLETE_ATTEMPTS + " attempts");
        return null;
    }

    private String parentCheckpointToken(Backup backup) {
        if (backup.isFull()) {
            return null;
        }
        Backup parent = backupRepository.findById(backup.getParentBackupId())
                .orElseThrow(() -> new SnapshotCaptureFailedException(
                        "Parent backup " + backup.getParentBackupId() + " no longer exists"));
        if (!parent.isCompleted()) {
            throw new SnapshotCaptureFailedException("Parent backup " + parent.getId() + " is " + parent.getStatus());
        }
        return parent.getCheckpointToken();
    }

    private SnapshotSource sourceForBackup(Backup backup) {
        SnapshotSource.SnapshotSourceBuilder source = SnapshotSource.builder()
                .sourceType(backup.getSourceType())
                .sourceId(backup.getSourceId())
                .scheduleId(backup.getScheduleId());
        if (backup.getScheduleId() != null) {
            scheduleRepository.findById(backup.getScheduleId())
                    .ifPresent(schedule -> source.checkpointName(schedule.getCheckpointName()));
        }
        return source.build();
    }

    static String storagePath(Backup backup) {
        return String.format("%s/%d/%s/%06d-%s.img",
                backup.getSourceType(), backup.getSourceId(), backup.getChainId(),
                backup.getSequenceNumber(), backup.getId());
    }

    private Map<String, String> metadataFor(Backup backup) {
        return Map.of(
                "backup-id", backup.getId().toString(),
                "chain-id", backup.getChainId().toString(),
                "sequence-number", String.valueOf(backup.getSequenceNumber()),
                "backup-mode", backup.getBackupMode());
    }

    /**
     * Carry the new checkpoint and last full backup forward for the next capture of the schedule.
     */
    private void recordScheduleState(Backup backup) {
        if (backup.getScheduleId() == null) {
            return;
        }
        try {
            scheduleRepository.findById(backup.getScheduleId()).ifPresent(schedule -> {
                if (backup.isFull()) {
                    schedule.setLastFullBackupId(backup.getId());
                }
                if (backup.getCheckpointToken() != null) {
                    schedule.setCheckpointName(backup.getCheckpointToken());
                }
                scheduleRepository.save(schedule);
            });
        } catch (Exception e) {
            log.warn("Failed to update schedule {} after backup {}: {}",
                    backup.getScheduleId(), backup.getId(), e.getMessage());
        }
    }

    private void discardArtifact(Long backendId, String path) {
        try {
            storageGateway.delete(backendId, path);
        } catch (RuntimeException e) {
            log.warn("Failed to discard artifact {} of cancelled backup: {}", path, e.getMessage());
        }
    }

    private boolean isCancelled(UUID backupId) {
        return backupRepository.findById(backupId)
                .map(b -> Backup.STATUS_CANCELLED.equals(b.getStatus()))
                .orElse(true);
    }

    /**
     * Mark a backup failed unless it already reached a final state, e.g. cancelled.
     */
    private void markBackupFailed(UUID backupId, String errorMessage) {
        try {
            backupRepository.findById(backupId).ifPresent(backup -> {
                if (!backup.isInFlight()) {
                    return;
                }
                backup.setStatus(Backup.STATUS_FAILED);
                backup.setErrorMessage(errorMessage);
                backupRepository.save(backup);
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Backup {} changed while being marked failed: {}", backupId, e.getMessage());
        }
    }

    /**
     * Cancel a pending or running backup. A running capture notices before it completes.
     */
    @Transactional
    public Backup cancelBackup(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));

        if (!backup.isInFlight()) {
            throw new IllegalStateException("Only pending or running backups can be cancelled. Current status: "
                    + backup.getStatus());
        }

        backup.setStatus(Backup.STATUS_CANCELLED);
        backup.setErrorMessage("Cancelled by request");
        backup = backupRepository.save(backup);
        log.info("Backup {} cancelled", backupId);
        return backup;
    }

    /**
     * List backups for a source.
     * By default, excludes deleted backups.
     */
    @Transactional(readOnly = true)
    public List<Backup> listBackups(String sourceType, Long sourceId, boolean includeDeleted) {
        validateSourceType(sourceType);
        List<Backup> backups = backupRepository.findBySourceTypeAndSourceIdOrderByCreatedAtDesc(sourceType, sourceId);

        if (!includeDeleted) {
            backups = backups.stream()
                    .filter(b -> !Backup.STATUS_DELETED.equals(b.getStatus()))
                    .toList();
        }

        return backups;
    }

    @Transactional(readOnly = true)
    public Backup getBackup(UUID backupId) {
        return backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));
    }
}
