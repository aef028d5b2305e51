package com.labbackup.api.service;

import com.labbackup.api.engine.ChainIntegrityChecker;
import com.labbackup.api.engine.GfsRetentionEvaluator;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.model.dto.BackupDeletionInfo;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.storage.StorageGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Removes backup artifacts in two phases: the row goes to delete_pending, the storage gateway
 * removes the object, and only then is the row marked deleted. A row left in delete_pending is
 * retried by the next retention sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupDeletionService {

    private static final Set<String> DEPENDENT_STATUSES = Set.of(
            Backup.STATUS_COMPLETED, Backup.STATUS_DELETE_PENDING,
            Backup.STATUS_PENDING, Backup.STATUS_RUNNING);

    private final BackupRepository backupRepository;
    private final StorageGateway storageGateway;
    private final ChainIntegrityChecker chainIntegrityChecker;

    /**
     * Get information about what will be deleted if this backup is deleted.
     * Used to show a confirmation dialog to the user.
     */
    @Transactional(readOnly = true)
    public BackupDeletionInfo getDeletionInfo(UUID backupId) {
        Backup backup = findDeletable(backupId);
        List<Backup> dependents = findDependentBackups(backup);
        return BackupDeletionInfo.from(backup, dependents, blockedReason(backup, dependents, Instant.now()));
    }

    /**
     * Delete a backup and the incrementals that depend on it, deepest first.
     *
     * @param confirmed whether the caller has confirmed cascade deletion
     */
    public void deleteBackup(UUID backupId, boolean confirmed) {
        Backup backup = findDeletable(backupId);
        List<Backup> dependents = findDependentBackups(backup);

        String blocked = blockedReason(backup, dependents, Instant.now());
        if (blocked != null) {
            throw new IllegalStateException("Backup cannot be deleted: " + blocked);
        }

        // If there are dependents and not confirmed, reject
        if (!dependents.isEmpty() && !confirmed) {
            throw new IllegalStateException(
                    "This backup has " + dependents.size() + " dependent backup(s). " +
                    "Use confirm=true to delete all, or call GET /deletion-info first to see details."
            );
        }

        for (Backup dependent : dependents) {
            if (!deleteArtifact(dependent)) {
                throw new IllegalStateException("Failed to delete dependent backup " + dependent.getId()
                        + "; remaining deletions will be retried by the next retention sweep");
            }
        }
        if (!deleteArtifact(backup)) {
            throw new IllegalStateException("Failed to delete backup " + backupId
                    + "; the deletion will be retried by the next retention sweep");
        }

        log.info("Backup deletion completed: {} primary + {} dependents deleted", 1, dependents.size());
    }

    /**
     * Runs both deletion phases for one backup.
     *
     * @return true once the row is marked deleted; false when the artifact could not be removed
     *         and the row stays delete_pending
     */
    public boolean deleteArtifact(Backup backup) {
        if (!Backup.STATUS_DELETE_PENDING.equals(backup.getStatus())) {
            backup.setStatus(Backup.STATUS_DELETE_PENDING);
            backup = backupRepository.save(backup);
        }

        if (backup.getStoragePath() != null) {
            boolean removed;
            try {
                removed = storageGateway.delete(backup.getStorageBackendId(), backup.getStoragePath());
            } catch (RuntimeException e) {
                log.warn("Storage delete failed for backup {} ({}): {}",
                        backup.getId(), backup.getStoragePath(), e.getMessage());
                return false;
            }
            if (!removed) {
                log.warn("Storage did not confirm removal of {} for backup {}", backup.getStoragePath(), backup.getId());
                return false;
            }
        }

        backup.setStatus(Backup.STATUS_DELETED);
        backup.setDeletedAt(Instant.now());
        backupRepository.save(backup);
        log.info("Deleted backup {} (chain {}, sequence {})",
                backup.getId(), backup.getChainId(), backup.getSequenceNumber());
        return true;
    }

    private Backup findDeletable(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));

        if (Backup.STATUS_DELETED.equals(backup.getStatus())) {
            throw new IllegalStateException("This backup is already deleted");
        }
        if (backup.isInFlight()) {
            throw new IllegalStateException("Backup is " + backup.getStatus() + "; cancel it before deleting");
        }
        return backup;
    }

    /**
     * Live descendants of a backup in its chain, deepest first.
     */
    private List<Backup> findDependentBackups(Backup backup) {
        List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(backup.getChainId());
        return chainIntegrityChecker.findDescendants(backup, members).stream()
                .filter(b -> DEPENDENT_STATUSES.contains(b.getStatus()))
                .toList();
    }

    private String blockedReason(Backup backup, List<Backup> dependents, Instant now) {
        String veto = GfsRetentionEvaluator.vetoReason(backup, now);
        if (veto != null) {
            return "backup is protected (" + veto + ")";
        }
        for (Backup dependent : dependents) {
            if (dependent.isInFlight()) {
                return "dependent backup " + dependent.getId() + " is still " + dependent.getStatus();
            }
            String dependentVeto = GfsRetentionEvaluator.vetoReason(dependent, now);
            if (dependentVeto != null) {
                return "dependent backup " + dependent.getId() + " is protected (" + dependentVeto + ")";
            }
        }
        return null;
    }
}
