package com.labbackup.api.service;

import com.labbackup.api.event.BackupVerificationRequestedEvent;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.storage.StorageGateway;
import com.labbackup.api.util.ChecksumUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.UUID;

/**
 * Re-reads stored artifacts and compares them with the checksum recorded at upload.
 * A match sets {@code verified}; a mismatch clears it and records the error on the row, which
 * the integrity checker then reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationService {

    private final BackupRepository backupRepository;
    private final StorageGateway storageGateway;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public Backup requestVerification(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));
        if (!backup.isCompleted()) {
            throw new IllegalStateException("Backup " + backupId + " is " + backup.getStatus()
                    + "; only completed backups can be verified");
        }
        eventPublisher.publishEvent(new BackupVerificationRequestedEvent(this, backupId));
        log.info("Verification requested for backup {}", backupId);
        return backup;
    }

    @Async
    public void verifyBackupAsync(UUID backupId) {
        try {
            verifyBackup(backupId);
        } catch (Exception e) {
            log.error("Verification of backup {} failed: {}", backupId, e.getMessage(), e);
        }
    }

    /**
     * @return true when the stored artifact matches the recorded checksum
     */
    public boolean verifyBackup(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));
        if (!backup.isCompleted() || backup.getStoragePath() == null) {
            log.info("Backup {} is {}, skipping verification", backupId, backup.getStatus());
            return false;
        }
        if (backup.getChecksum() == null) {
            log.warn("Backup {} has no recorded checksum, cannot verify", backupId);
            return false;
        }

        MessageDigest digest = ChecksumUtils.sha256();
        try (InputStream in = new DigestInputStream(
                storageGateway.get(backup.getStorageBackendId(), backup.getStoragePath()), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact of backup " + backupId, e);
        }

        String actual = ChecksumUtils.hex(digest);
        boolean matches = ChecksumUtils.matches(backup.getChecksum(), actual);
        if (matches) {
            log.info("Backup {} verified", backupId);
        } else {
            log.error("Checksum mismatch for backup {} (expected {}, got {})", backupId, backup.getChecksum(), actual);
        }
        recordResult(backupId, matches, actual);
        return matches;
    }

    private void recordResult(UUID backupId, boolean matches, String actual) {
        try {
            backupRepository.findById(backupId).ifPresent(current -> {
                current.setVerified(matches);
                if (!matches) {
                    current.setErrorMessage("Checksum mismatch on verification: stored artifact hashes to " + actual);
                }
                backupRepository.save(current);
            });
        } catch (ObjectOptimisticLockingFailureException e) {
            log.warn("Backup {} changed during verification, result not recorded", backupId);
        }
    }
}
