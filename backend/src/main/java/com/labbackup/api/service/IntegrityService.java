package com.labbackup.api.service;

import com.labbackup.api.engine.ChainIntegrityChecker;
import com.labbackup.api.engine.IntegrityReport;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrityService {

    private final BackupRepository backupRepository;
    private final ChainIntegrityChecker chainIntegrityChecker;

    @Transactional(readOnly = true)
    public IntegrityReport checkIntegrity(UUID chainId) {
        List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(chainId);
        if (members.isEmpty()) {
            throw ApiException.notFound("Chain", chainId);
        }
        return checkIntegrity(chainId, members);
    }

    /**
     * Check a chain whose members the caller already loaded.
     */
    public IntegrityReport checkIntegrity(UUID chainId, List<Backup> members) {
        IntegrityReport report = chainIntegrityChecker.check(chainId, members, backupRepository::existsById);
        if (!report.isRestorable()) {
            log.warn("Chain {} has {} critical issue(s); restorable through sequence {} of {}",
                    chainId, report.getCriticalCount(), report.getRestorableThroughSequence(),
                    report.getLatestSequence());
        } else if (!report.isValid()) {
            log.debug("Chain {} has {} warning(s)", chainId, report.getWarningCount());
        }
        return report;
    }

    @Transactional(readOnly = true)
    public boolean isLoadBearing(UUID backupId) {
        Backup backup = backupRepository.findById(backupId)
                .orElseThrow(() -> ApiException.notFound("Backup", backupId));
        return chainIntegrityChecker.isLoadBearing(backup,
                backupRepository.findByChainIdOrderBySequenceNumberAsc(backup.getChainId()));
    }
}
