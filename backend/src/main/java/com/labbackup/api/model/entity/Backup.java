package com.labbackup.api.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "backups", indexes = {
        @Index(name = "idx_backups_source", columnList = "source_type, source_id"),
        @Index(name = "idx_backups_chain", columnList = "chain_id, sequence_number"),
        @Index(name = "idx_backups_parent", columnList = "parent_backup_id"),
        @Index(name = "idx_backups_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Backup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_type", nullable = false, length = 20)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "schedule_id")
    private UUID scheduleId;

    // Chain identity, frozen once the backup completes
    @Column(name = "chain_id", nullable = false)
    private UUID chainId;

    @Column(name = "sequence_number", nullable = false)
    private Integer sequenceNumber;

    @Column(name = "parent_backup_id")
    private UUID parentBackupId;

    @Column(name = "backup_mode", nullable = false, length = 20)
    private String backupMode;

    @Column(name = "mode_reason", length = 50)
    private String modeReason;

    @Column(name = "checkpoint_token", length = 255)
    private String checkpointToken;

    @Column(nullable = false, length = 20)
    @Builder.Default
    private String status = STATUS_PENDING;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "compressed_size_bytes")
    private Long compressedSizeBytes;

    @Column(length = 128)
    private String checksum;

    @Column(name = "storage_path", length = 500)
    private String storagePath;

    @Column(name = "storage_backend_id", nullable = false)
    private Long storageBackendId;

    @Column(nullable = false)
    @Builder.Default
    private boolean verified = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean immutable = false;

    @Column(name = "retention_until")
    private Instant retentionUntil;

    @Column(name = "legal_hold_enabled", nullable = false)
    @Builder.Default
    private boolean legalHoldEnabled = false;

    @Column(name = "legal_hold_reason", length = 500)
    private String legalHoldReason;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    // Cancel and complete race on the same row; the loser re-reads
    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Backup statuses
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_CANCELLED = "cancelled";
    public static final String STATUS_DELETE_PENDING = "delete_pending";
    public static final String STATUS_DELETED = "deleted";

    // Backup modes
    public static final String MODE_FULL = "full";
    public static final String MODE_INCREMENTAL = "incremental";

    // Source types
    public static final String SOURCE_VM = "vm";
    public static final String SOURCE_CONTAINER = "container";

    public boolean isFull() {
        return MODE_FULL.equals(backupMode);
    }

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    /**
     * Pending or running, i.e. a capture that may still become a completed chain member.
     */
    public boolean isInFlight() {
        return STATUS_PENDING.equals(status) || STATUS_RUNNING.equals(status);
    }
}
