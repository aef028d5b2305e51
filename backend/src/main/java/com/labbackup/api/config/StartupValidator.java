package com.labbackup.api.config;

import com.labbackup.api.model.entity.RetentionConfig;
import com.labbackup.api.service.storage.S3StorageGateway;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Validates backup engine configuration on application startup.
 * Fails fast on settings that would make chain decisions or retention sweeps misbehave.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupValidator {

    private final S3StorageGateway storageGateway;

    @Value("${backup.chain.default-max-length:30}")
    private int defaultMaxChainLength;

    @Value("${backup.chain.capability-check-attempts:3}")
    private int capabilityCheckAttempts;

    @Value("${backup.retention.zone:UTC}")
    private String retentionZone;

    @Value("${backup.retention.sweep-cron:0 0 5 * * *}")
    private String sweepCron;

    @Value("${backup.retention.daily:7}")
    private int defaultDaily;

    @Value("${backup.retention.weekly:4}")
    private int defaultWeekly;

    @Value("${backup.retention.monthly:12}")
    private int defaultMonthly;

    @Value("${backup.retention.yearly:5}")
    private int defaultYearly;

    @Value("${backup.restore.throughput-bytes-per-second:104857600}")
    private long restoreThroughput;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateChainSettings();
        validateRetentionSettings();
        validateStorage();

        log.info("Startup configuration validation complete");
    }

    private void validateChainSettings() {
        if (defaultMaxChainLength < 1) {
            throw new IllegalStateException(
                    "backup.chain.default-max-length must be at least 1, got " + defaultMaxChainLength);
        }
        if (capabilityCheckAttempts < 1) {
            throw new IllegalStateException(
                    "backup.chain.capability-check-attempts must be at least 1, got " + capabilityCheckAttempts);
        }
        if (restoreThroughput <= 0) {
            throw new IllegalStateException(
                    "backup.restore.throughput-bytes-per-second must be positive, got " + restoreThroughput);
        }
        log.info("Chain settings: default max length {}, capability check attempts {}", defaultMaxChainLength, capabilityCheckAttempts);
    }

    private void validateRetentionSettings() {
        try {
            ZoneId.of(retentionZone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("backup.retention.zone is not a valid zone id: " + retentionZone, e);
        }

        if (!CronExpression.isValidExpression(sweepCron)) {
            throw new IllegalStateException("backup.retention.sweep-cron is not a valid cron expression: " + sweepCron);
        }

        try {
            RetentionConfig.of(defaultDaily, defaultWeekly, defaultMonthly, defaultYearly).validate();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Default retention tiers are invalid: " + e.getMessage(), e);
        }
    }

    private void validateStorage() {
        if (!storageGateway.isConfigured()) {
            log.warn("S3 storage not configured. Backups will fail at upload until it is.");
        }
    }
}
