package com.labbackup.api.model.entity;

import com.labbackup.api.util.RetentionConfigConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "backup_schedules", indexes = {
        @Index(name = "idx_schedules_source", columnList = "source_type, source_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BackupSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "source_type", nullable = false, length = 20)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "storage_backend_id", nullable = false)
    private Long storageBackendId;

    @Column(name = "cron_expression", nullable = false, length = 100)
    private String cronExpression;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "backup_mode_policy", nullable = false, length = 30)
    @Builder.Default
    private String backupModePolicy = POLICY_AUTO;

    @Column(name = "max_chain_length")
    private Integer maxChainLength;

    @Column(name = "full_backup_day")
    private Integer fullBackupDay;

    @Column(name = "last_full_backup_id")
    private UUID lastFullBackupId;

    @Column(name = "checkpoint_name", length = 255)
    private String checkpointName;

    @Convert(converter = RetentionConfigConverter.class)
    @Column(name = "retention_config", columnDefinition = "TEXT")
    private RetentionConfig retentionConfig;

    @Column(name = "last_run")
    private Instant lastRun;

    @Column(name = "next_run")
    private Instant nextRun;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Backup mode policies
    public static final String POLICY_AUTO = "auto";
    public static final String POLICY_FULL_ONLY = "full_only";
    public static final String POLICY_INCREMENTAL_PREFERRED = "incremental_preferred";
}
