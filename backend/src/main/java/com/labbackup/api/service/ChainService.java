package com.labbackup.api.service;

import com.labbackup.api.engine.ChainBuilder;
import com.labbackup.api.engine.ChainDecision;
import com.labbackup.api.engine.ChainIntegrityChecker;
import com.labbackup.api.engine.ChainPolicy;
import com.labbackup.api.engine.IntegrityIssue;
import com.labbackup.api.engine.IntegrityReport;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.model.dto.ChainStatistics;
import com.labbackup.api.model.dto.GlobalStatistics;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.snapshot.SnapshotSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Derives chain identity for new backups and exposes read access to chains.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChainService {

    private final BackupRepository backupRepository;
    private final SnapshotProducer snapshotProducer;
    private final ChainBuilder chainBuilder;
    private final ChainIntegrityChecker chainIntegrityChecker;

    @Value("${backup.chain.capability-check-attempts:3}")
    private int capabilityCheckAttempts;

    @Value("${backup.retention.zone:UTC}")
    private String zone;

    /**
     * Preview of the decision the next trigger of this schedule would get. Takes no lock, so
     * a concurrent trigger may still be assigned differently.
     */
    @Transactional(readOnly = true)
    public ChainDecision buildChainDecision(BackupSchedule schedule) {
        return decide(ChainPolicy.fromSchedule(schedule), sourceFor(schedule));
    }

    /**
     * Decides mode and chain identity for the next backup of {@code source}. Callers that persist
     * the decision must hold the source lock.
     */
    public ChainDecision decide(ChainPolicy policy, SnapshotSource source) {
        Backup prior = findLatestCompleted(source.getSourceType(), source.getSourceId());
        List<Backup> priorChain = prior != null
                ? backupRepository.findByChainIdOrderBySequenceNumberAsc(prior.getChainId())
                : List.of();
        if (prior != null && !isRestorableTo(prior, priorChain)) {
            ChainDecision decision = chainBuilder.startAfterBrokenChain(policy, prior);
            log.info("New chain {} for {} {} ({})", decision.getChainId(), source.getSourceType(),
                    source.getSourceId(), decision.getReason());
            return decision;
        }

        LocalDate today = LocalDate.now(ZoneId.of(zone));
        LocalDate chainStartedOn = chainStartDate(priorChain);

        boolean incrementalSupported = chainBuilder.needsCapabilityCheck(policy, prior, chainStartedOn, today)
                && checkIncrementalSupport(policy, source);

        ChainDecision decision = chainBuilder.decide(policy, prior, chainStartedOn, today, incrementalSupported);
        if (decision.isFull()) {
            log.info("New chain {} for {} {} ({})", decision.getChainId(), source.getSourceType(),
                    source.getSourceId(), decision.getReason());
        } else {
            log.info("Continuing chain {} for {} {} at sequence {}", decision.getChainId(),
                    source.getSourceType(), source.getSourceId(), decision.getSequenceNumber());
        }
        return decision;
    }

    /**
     * Newest completed backup of a source. Failed and cancelled rows are never returned, so a failed
     * incremental leaves its sequence number free for the retry.
     */
    @Transactional(readOnly = true)
    public Backup findLatestCompleted(String sourceType, Long sourceId) {
        return backupRepository.findCompletedBySourceNewestFirst(sourceType, sourceId).stream()
                .findFirst()
                .orElse(null);
    }

    /**
     * {@code auto} checks once; {@code incremental_preferred} retries before giving up.
     * A capability check that throws counts as unsupported.
     */
    boolean checkIncrementalSupport(ChainPolicy policy, SnapshotSource source) {
        int attempts = policy.isIncrementalPreferred() ? Math.max(1, capabilityCheckAttempts) : 1;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (snapshotProducer.checkIncrementalCapability(source)) {
                    return true;
                }
                log.debug("Incremental capability check {}/{} negative for {} {}", attempt, attempts,
                        source.getSourceType(), source.getSourceId());
            } catch (RuntimeException e) {
                log.warn("Incremental capability check {}/{} failed for {} {}: {}", attempt, attempts,
                        source.getSourceType(), source.getSourceId(), e.getMessage());
            }
        }
        return false;
    }

    private boolean isRestorableTo(Backup prior, List<Backup> chainMembers) {
        IntegrityReport report = chainIntegrityChecker.check(prior.getChainId(), chainMembers,
                backupRepository::existsById);
        return report.isRestorableTo(prior.getSequenceNumber());
    }

    private LocalDate chainStartDate(List<Backup> chainMembers) {
        return chainMembers.stream()
                .filter(b -> b.getSequenceNumber() == 0 && b.isCompleted() && b.getCompletedAt() != null)
                .findFirst()
                .map(b -> b.getCompletedAt().atZone(ZoneId.of(zone)).toLocalDate())
                .orElse(null);
    }

    @Transactional(readOnly = true)
    public List<Backup> getChain(UUID chainId) {
        List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(chainId);
        if (members.isEmpty()) {
            throw ApiException.notFound("Chain", chainId);
        }
        return members;
    }

    @Transactional(readOnly = true)
    public List<UUID> listChainIds(String sourceType, Long sourceId) {
        return backupRepository.findChainIdsBySource(sourceType, sourceId);
    }

    @Transactional(readOnly = true)
    public ChainStatistics getChainStatistics(UUID chainId) {
        return ChainStatistics.from(chainId, getChain(chainId));
    }

    /**
     * Completed backups of a source whose parent row no longer exists. Such a backup cannot be
     * restored, and neither can anything after it in its chain.
     */
    @Transactional(readOnly = true)
    public List<Backup> findOrphanedBackups(String sourceType, Long sourceId) {
        List<Backup> orphaned = new ArrayList<>();
        for (UUID chainId : backupRepository.findChainIdsBySource(sourceType, sourceId)) {
            orphaned.addAll(orphansOf(chainId, backupRepository.findByChainIdOrderBySequenceNumberAsc(chainId)));
        }
        if (!orphaned.isEmpty()) {
            log.warn("Found {} orphaned backup(s) for {} {}", orphaned.size(), sourceType, sourceId);
        }
        return orphaned;
    }

    /**
     * Size, compression and health totals across every chain that still has live rows.
     */
    @Transactional(readOnly = true)
    public GlobalStatistics getGlobalStatistics() {
        List<ChainStatistics> chains = new ArrayList<>();
        int brokenChains = 0;
        int orphanedBackups = 0;
        for (UUID chainId : backupRepository.findLiveChainIds()) {
            List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(chainId);
            IntegrityReport report = chainIntegrityChecker.check(chainId, members, backupRepository::existsById);
            if (!report.isRestorable()) {
                brokenChains++;
            }
            orphanedBackups += orphanIds(report).size();
            chains.add(ChainStatistics.from(chainId, members));
        }
        return GlobalStatistics.from(chains, brokenChains, orphanedBackups);
    }

    private List<Backup> orphansOf(UUID chainId, List<Backup> members) {
        if (members.isEmpty()) {
            return Collections.emptyList();
        }
        Set<UUID> ids = orphanIds(chainIntegrityChecker.check(chainId, members, backupRepository::existsById));
        return members.stream().filter(m -> ids.contains(m.getId())).toList();
    }

    private static Set<UUID> orphanIds(IntegrityReport report) {
        return report.getIssues().stream()
                .filter(issue -> IntegrityIssue.CODE_ORPHANED_INCREMENTAL.equals(issue.getCode()))
                .map(IntegrityIssue::getBackupId)
                .collect(Collectors.toSet());
    }

    public static SnapshotSource sourceFor(BackupSchedule schedule) {
        return SnapshotSource.builder()
                .sourceType(schedule.getSourceType())
                .sourceId(schedule.getSourceId())
                .scheduleId(schedule.getId())
                .checkpointName(schedule.getCheckpointName())
                .build();
    }
}
