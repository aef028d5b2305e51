package com.labbackup.api.service;

import com.labbackup.api.engine.ChainIntegrityChecker;
import com.labbackup.api.engine.GfsRetentionEvaluator;
import com.labbackup.api.engine.RetentionResult;
import com.labbackup.api.model.dto.RetentionSweepResult;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.model.entity.RetentionConfig;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.repository.BackupScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Applies grandfather-father-son retention per source and deletes what falls out of it.
 * Sweeps are idempotent and handle each source in isolation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetentionService {

    private static final List<String> IN_FLIGHT_STATUSES = List.of(Backup.STATUS_PENDING, Backup.STATUS_RUNNING);

    private final BackupRepository backupRepository;
    private final BackupScheduleRepository scheduleRepository;
    private final GfsRetentionEvaluator retentionEvaluator;
    private final ChainIntegrityChecker chainIntegrityChecker;
    private final BackupDeletionService deletionService;

    @Value("${backup.enabled:false}")
    private boolean backupEnabled;

    @Value("${backup.retention.daily:7}")
    private int retentionDaily;

    @Value("${backup.retention.weekly:4}")
    private int retentionWeekly;

    @Value("${backup.retention.monthly:12}")
    private int retentionMonthly;

    @Value("${backup.retention.yearly:5}")
    private int retentionYearly;

    /**
     * Keep and delete sets for a source under the given config. Read-only.
     */
    @Transactional(readOnly = true)
    public RetentionResult evaluateRetention(String sourceType, Long sourceId, RetentionConfig config) {
        BackupService.validateSourceType(sourceType);
        List<Backup> completed = backupRepository.findCompletedBySourceOldestFirst(sourceType, sourceId);
        List<Backup> inFlight = backupRepository.findBySourceTypeAndSourceIdAndStatusIn(
                sourceType, sourceId, IN_FLIGHT_STATUSES);
        return retentionEvaluator.evaluate(completed, inFlight, config, Instant.now());
    }

    /**
     * Tier-wise maximum over the source's enabled schedules; the configured defaults when none
     * of them carries a retention config.
     */
    @Transactional(readOnly = true)
    public RetentionConfig effectiveConfig(String sourceType, Long sourceId) {
        return scheduleRepository.findBySourceTypeAndSourceId(sourceType, sourceId).stream()
                .filter(BackupSchedule::isEnabled)
                .map(BackupSchedule::getRetentionConfig)
                .filter(Objects::nonNull)
                .reduce(RetentionConfig::union)
                .orElseGet(this::defaultConfig);
    }

    public RetentionConfig defaultConfig() {
        return RetentionConfig.of(retentionDaily, retentionWeekly, retentionMonthly, retentionYearly);
    }

    /**
     * Retry leftover delete_pending rows, evaluate, then delete candidates deepest first.
     * Each candidate is re-checked against current state just before deletion.
     */
    public RetentionSweepResult sweepSource(String sourceType, Long sourceId) {
        RetentionSweepResult result = RetentionSweepResult.builder()
                .sourceType(sourceType)
                .sourceId(sourceId)
                .build();

        List<Backup> leftovers = new ArrayList<>(backupRepository.findBySourceTypeAndSourceIdAndStatus(
                sourceType, sourceId, Backup.STATUS_DELETE_PENDING));
        leftovers.sort(Comparator.comparing(Backup::getSequenceNumber).reversed());
        for (Backup leftover : leftovers) {
            if (deletionService.deleteArtifact(leftover)) {
                result.getDeleted().add(leftover.getId());
            } else {
                result.getFailed().add(leftover.getId());
            }
        }

        RetentionResult evaluation = evaluateRetention(sourceType, sourceId, effectiveConfig(sourceType, sourceId));
        result.getVetoed().putAll(evaluation.getVetoed());
        result.getLoadBearing().addAll(evaluation.getLoadBearing());

        for (Backup candidate : evaluation.getDelete()) {
            Backup current = backupRepository.findById(candidate.getId()).orElse(null);
            String skipReason = skipReason(current);
            if (skipReason != null) {
                log.info("Skipping deletion of backup {}: {}", candidate.getId(), skipReason);
                result.getSkipped().put(candidate.getId(), skipReason);
                continue;
            }
            if (deletionService.deleteArtifact(current)) {
                result.getDeleted().add(candidate.getId());
            } else {
                result.getFailed().add(candidate.getId());
            }
        }

        log.info("Retention sweep for {} {}: {} deleted, {} failed, {} vetoed, {} load-bearing, {} skipped",
                sourceType, sourceId, result.getDeleted().size(), result.getFailed().size(),
                result.getVetoed().size(), result.getLoadBearing().size(), result.getSkipped().size());
        return result;
    }

    private String skipReason(Backup current) {
        if (current == null || !current.isCompleted()) {
            return "no longer completed";
        }
        String veto = GfsRetentionEvaluator.vetoReason(current, Instant.now());
        if (veto != null) {
            return "protected (" + veto + ")";
        }
        List<Backup> members = backupRepository.findByChainIdOrderBySequenceNumberAsc(current.getChainId());
        if (chainIntegrityChecker.isLoadBearing(current, members)) {
            return RetentionResult.REASON_LOAD_BEARING;
        }
        return null;
    }

    /**
     * Sweep every source that still owns completed or delete-pending backups, scheduled or not.
     * Sources without an enabled schedule fall back to the default retention config.
     * One source's failure does not stop the others.
     */
    public List<RetentionSweepResult> sweepAll() {
        List<RetentionSweepResult> results = new ArrayList<>();
        for (BackupRepository.SourceRef source : backupRepository.findSourcesWithRetainedBackups()) {
            try {
                results.add(sweepSource(source.getSourceType(), source.getSourceId()));
            } catch (Exception e) {
                log.error("Retention sweep failed for {} {}: {}",
                        source.getSourceType(), source.getSourceId(), e.getMessage(), e);
            }
        }
        return results;
    }

    @Scheduled(cron = "${backup.retention.sweep-cron:0 0 5 * * *}", zone = "${backup.retention.zone:UTC}")
    public void scheduledSweep() {
        if (!backupEnabled) {
            return;
        }
        log.info("Starting retention sweep...");
        List<RetentionSweepResult> results = sweepAll();
        log.info("Retention sweep completed for {} source(s)", results.size());
    }
}
