package com.labbackup.api.service;

import com.labbackup.api.engine.IntegrityReport;
import com.labbackup.api.engine.RestorationPlan;
import com.labbackup.api.engine.RestorationPlanner;
import com.labbackup.api.engine.RestorationStep;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.exception.ChainBrokenException;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.storage.StorageGateway;
import com.labbackup.api.util.ChecksumUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class RestorationService {

    private final BackupRepository backupRepository;
    private final IntegrityService integrityService;
    private final RestorationPlanner restorationPlanner;
    private final StorageGateway storageGateway;

    /**
     * Plan the restore of a backup. Read-only.
     *
     * @throws ChainBrokenException if the target lies beyond a broken link of its chain
     */
    @Transactional(readOnly = true)
    public RestorationPlan planRestoration(UUID targetBackupId) {
        Backup target = backupRepository.findById(targetBackupId)
                .orElseThrow(() -> ApiException.notFound("Backup", targetBackupId));

        List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(target.getChainId());
        IntegrityReport report = integrityService.checkIntegrity(target.getChainId(), members);

        try {
            RestorationPlan plan = restorationPlanner.plan(target, members, report);
            log.info("Restoration plan for backup {}: {} steps, {}", targetBackupId,
                    plan.getStepCount(), plan.getFormattedTotalSize());
            return plan;
        } catch (ChainBrokenException e) {
            log.warn("Cannot restore backup {}: {}", targetBackupId, e.getMessage());
            throw e;
        }
    }

    /**
     * Re-plan against the current chain state, check every artifact against its recorded checksum,
     * then stream the artifacts to the sink in plan order. Nothing reaches the sink unless the whole
     * plan passed the check. The apply pass digests the bytes again and fails the restore if an
     * artifact changed in between.
     */
    public RestorationPlan executeRestoration(UUID targetBackupId, RestoreSink sink) {
        RestorationPlan plan = planRestoration(targetBackupId);

        for (RestorationStep step : plan.getSteps()) {
            MessageDigest digest = ChecksumUtils.sha256();
            try (InputStream in = new DigestInputStream(open(step), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read artifact of backup " + step.getBackupId(), e);
            }
            requireChecksum(step, digest);
        }
        log.info("Checked {} artifact(s) for restore of backup {}", plan.getStepCount(), targetBackupId);

        for (RestorationStep step : plan.getSteps()) {
            MessageDigest digest = ChecksumUtils.sha256();
            try (InputStream in = new DigestInputStream(open(step), digest)) {
                sink.apply(step, in);
                // Drain whatever the sink left unread so the digest covers the whole artifact
                in.transferTo(OutputStream.nullOutputStream());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to apply step " + step.getStepNumber()
                        + " (backup " + step.getBackupId() + ")", e);
            }
            requireChecksum(step, digest);
            log.info("Applied restore step {}/{} ({} sequence {})", step.getStepNumber(), plan.getStepCount(),
                    step.getAction(), step.getSequenceNumber());
        }

        log.info("Restore of backup {} completed", targetBackupId);
        return plan;
    }

    private InputStream open(RestorationStep step) {
        return storageGateway.get(step.getStorageBackendId(), step.getStoragePath());
    }

    private static void requireChecksum(RestorationStep step, MessageDigest digest) {
        String actual = ChecksumUtils.hex(digest);
        if (step.getChecksum() != null && !ChecksumUtils.matches(step.getChecksum(), actual)) {
            throw new IllegalStateException("Checksum mismatch for backup " + step.getBackupId()
                    + " at sequence " + step.getSequenceNumber());
        }
    }
}
