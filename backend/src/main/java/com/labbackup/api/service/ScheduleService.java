package com.labbackup.api.service;

import com.labbackup.api.engine.ChainPolicy;
import com.labbackup.api.exception.ApiException;
import com.labbackup.api.exception.BackupInProgressException;
import com.labbackup.api.model.dto.ScheduleRequest;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.repository.BackupScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Schedule CRUD and the poller that triggers due schedules.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final BackupScheduleRepository scheduleRepository;
    private final BackupService backupService;

    @Value("${backup.enabled:false}")
    private boolean backupEnabled;

    @Value("${backup.retention.zone:UTC}")
    private String zone;

    @Transactional
    public BackupSchedule createSchedule(ScheduleRequest request) {
        validate(request);

        BackupSchedule schedule = BackupSchedule.builder()
                .name(request.getName())
                .sourceType(request.getSourceType())
                .sourceId(request.getSourceId())
                .storageBackendId(request.getStorageBackendId())
                .cronExpression(normalizeCron(request.getCronExpression()))
                .enabled(request.getEnabled() == null || request.getEnabled())
                .backupModePolicy(request.getBackupModePolicy() != null
                        ? request.getBackupModePolicy() : BackupSchedule.POLICY_AUTO)
                .maxChainLength(request.getMaxChainLength())
                .fullBackupDay(request.getFullBackupDay())
                .retentionConfig(request.getRetentionConfig())
                .build();
        schedule.setNextRun(schedule.isEnabled() ? nextRun(schedule.getCronExpression(), Instant.now()) : null);

        schedule = scheduleRepository.save(schedule);
        log.info("Created schedule {} ({}) for {} {}", schedule.getId(), schedule.getName(),
                schedule.getSourceType(), schedule.getSourceId());
        return schedule;
    }

    /**
     * Replace a schedule's settings. Chain state (last full backup, checkpoint) is kept.
     */
    @Transactional
    public BackupSchedule updateSchedule(UUID scheduleId, ScheduleRequest request) {
        validate(request);
        BackupSchedule schedule = getSchedule(scheduleId);

        schedule.setName(request.getName());
        schedule.setSourceType(request.getSourceType());
        schedule.setSourceId(request.getSourceId());
        schedule.setStorageBackendId(request.getStorageBackendId());
        schedule.setCronExpression(normalizeCron(request.getCronExpression()));
        if (request.getEnabled() != null) {
            schedule.setEnabled(request.getEnabled());
        }
        if (request.getBackupModePolicy() != null) {
            schedule.setBackupModePolicy(request.getBackupModePolicy());
        }
        schedule.setMaxChainLength(request.getMaxChainLength());
        schedule.setFullBackupDay(request.getFullBackupDay());
        schedule.setRetentionConfig(request.getRetentionConfig());
        schedule.setNextRun(schedule.isEnabled() ? nextRun(schedule.getCronExpression(), Instant.now()) : null);

        schedule = scheduleRepository.save(schedule);
        log.info("Updated schedule {}", scheduleId);
        return schedule;
    }

    @Transactional
    public void deleteSchedule(UUID scheduleId) {
        BackupSchedule schedule = getSchedule(scheduleId);
        scheduleRepository.delete(schedule);
        log.info("Deleted schedule {} ({})", scheduleId, schedule.getName());
    }

    @Transactional(readOnly = true)
    public BackupSchedule getSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> ApiException.notFound("Schedule", scheduleId));
    }

    @Transactional(readOnly = true)
    public List<BackupSchedule> listSchedules(String sourceType, Long sourceId) {
        if (sourceType != null && sourceId != null) {
            return scheduleRepository.findBySourceTypeAndSourceId(sourceType, sourceId);
        }
        return scheduleRepository.findAll();
    }

    @Scheduled(fixedDelayString = "${backup.scheduler.poll-interval-ms:60000}")
    public void pollDueSchedules() {
        if (!backupEnabled) {
            return;
        }
        runDueSchedules(Instant.now());
    }

    /**
     * Trigger every enabled schedule whose next run is due and move its next run forward.
     *
     * @return number of backups created
     */
    public int runDueSchedules(Instant now) {
        List<BackupSchedule> due = scheduleRepository.findDueSchedules(now);
        int triggered = 0;

        for (BackupSchedule schedule : due) {
            try {
                backupService.triggerScheduledBackup(schedule.getId());
                triggered++;
            } catch (BackupInProgressException e) {
                log.info("Skipping schedule {}: {}", schedule.getId(), e.getMessage());
            } catch (Exception e) {
                log.error("Failed to trigger schedule {}: {}", schedule.getId(), e.getMessage(), e);
            } finally {
                advance(schedule.getId(), now);
            }
        }

        if (!due.isEmpty()) {
            log.info("Schedule poll: {} due, {} triggered", due.size(), triggered);
        }
        return triggered;
    }

    private void advance(UUID scheduleId, Instant now) {
        try {
            // Re-read so a completion that just updated the checkpoint is not overwritten
            scheduleRepository.findById(scheduleId).ifPresent(schedule -> {
                schedule.setLastRun(now);
                schedule.setNextRun(nextRun(schedule.getCronExpression(), now));
                scheduleRepository.save(schedule);
            });
        } catch (Exception e) {
            log.error("Failed to advance schedule {}: {}", scheduleId, e.getMessage(), e);
        }
    }

    Instant nextRun(String cronExpression, Instant after) {
        ZonedDateTime next = CronExpression.parse(cronExpression).next(after.atZone(ZoneId.of(zone)));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Accept classic 5-field cron by adding a zero seconds field.
     */
    static String normalizeCron(String cronExpression) {
        String trimmed = cronExpression.trim();
        if (trimmed.split("\\s+").length == 5) {
            return "0 " + trimmed;
        }
        return trimmed;
    }

    private void validate(ScheduleRequest request) {
        BackupService.validateSourceType(request.getSourceType());
        if (request.getCronExpression() == null
                || !CronExpression.isValidExpression(normalizeCron(request.getCronExpression()))) {
            throw new IllegalArgumentException("Invalid cron expression: " + request.getCronExpression());
        }
        if (request.getBackupModePolicy() != null && !ChainPolicy.isKnownPolicy(request.getBackupModePolicy())) {
            throw new IllegalArgumentException("Invalid backup mode policy: " + request.getBackupModePolicy());
        }
        if (request.getMaxChainLength() != null && request.getMaxChainLength() < 1) {
            throw new IllegalArgumentException("maxChainLength must be at least 1");
        }
        if (request.getFullBackupDay() != null
                && (request.getFullBackupDay() < 1 || request.getFullBackupDay() > 31)) {
            throw new IllegalArgumentException("fullBackupDay must be between 1 and 31");
        }
        if (request.getRetentionConfig() != null) {
            request.getRetentionConfig().validate();
        }
    }
}
