package com.labbackup.api.service;

import com.labbackup.api.exception.ApiException;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutability and legal hold. Both only ever increase protection; lifting them is an
 * administrative action outside this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProtectionService {

    private final BackupRepository backupRepository;

    @Transactional
    public Backup makeImmutable(UUID backupId, Instant retentionUntil) {
        if (retentionUntil == null) {
            throw new IllegalArgumentException("retentionUntil is required");
        }
        if (!retentionUntil.isAfter(Instant.now())) {
            throw new IllegalArgumentException("retentionUntil must be in the future");
        }

        Backup backup = findCompleted(backupId);
        if (backup.getRetentionUntil() != null && retentionUntil.isBefore(backup.getRetentionUntil())) {
            throw new IllegalStateException("Retention can only be extended; current retention is until "
                    + backup.getRetentionUntil());
        }

        backup.setImmutable(true);
        backup.setRetentionUntil(retentionUntil);
        backup = backupRepository.save(backup);
        log.info("Backup {} made immutable until {}", backupId, retentionUntil);
        return backup;
    }

    @Transactional
    public Backup enableLegalHold(UUID backupId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A legal hold reason is required");
        }

        Backup backup = findCompleted(backupId);
        if (backup.isLegalHoldEnabled()) {
            log.info("Backup {} is already under legal hold", backupId);
            return backup;
        }

        backup.setLegalHoldEnabled(true);
        backup.setLegalHoldReason(reason);
        backup = backupRepository.save(backup);
        log.info("Legal hold enabled on backup {}: {}", backupId, reason);
        return backup;
    }

    private Backup findCompleted(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));
        if (!backup.isCompleted()) {
            throw new IllegalStateException("Only completed backups can be protected. Current status: "
                    + backup.getStatus());
        }
        return backup;
    }
}
