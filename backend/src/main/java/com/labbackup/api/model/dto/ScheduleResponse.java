package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.model.entity.RetentionConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private String name;
    private String sourceType;
    private Long sourceId;
    private Long storageBackendId;
    private String cronExpression;
    private boolean enabled;
    private String backupModePolicy;
    private Integer maxChainLength;
    private Integer fullBackupDay;
    private UUID lastFullBackupId;
    private String checkpointName;
    private RetentionConfig retentionConfig;
    private Instant lastRun;
    private Instant nextRun;
    private Instant createdAt;
    private Instant updatedAt;

    public static ScheduleResponse fromEntity(BackupSchedule schedule) {
        return ScheduleResponse.builder()
                .id(schedule.getId())
                .name(schedule.getName())
                .sourceType(schedule.getSourceType())
                .sourceId(schedule.getSourceId())
                .storageBackendId(schedule.getStorageBackendId())
                .cronExpression(schedule.getCronExpression())
                .enabled(schedule.isEnabled())
                .backupModePolicy(schedule.getBackupModePolicy())
                .maxChainLength(schedule.getMaxChainLength())
                .fullBackupDay(schedule.getFullBackupDay())
                .lastFullBackupId(schedule.getLastFullBackupId())
                .checkpointName(schedule.getCheckpointName())
                .retentionConfig(schedule.getRetentionConfig())
                .lastRun(schedule.getLastRun())
                .nextRun(schedule.getNextRun())
                .createdAt(schedule.getCreatedAt())
                .updatedAt(schedule.getUpdatedAt())
                .build();
    }
}
