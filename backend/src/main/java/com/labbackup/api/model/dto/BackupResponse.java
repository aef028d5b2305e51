package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class BackupResponse {

    private UUID id;
    private String sourceType;
    private Long sourceId;
    private UUID scheduleId;
    private UUID chainId;
    private Integer sequenceNumber;
    private UUID parentBackupId;
    private String backupMode;
    private String modeReason;
    private String status;
    private Long sizeBytes;
    private Long compressedSizeBytes;
    private String formattedSize;
    private String checksum;
    private boolean verified;
    private String storagePath;
    private Long storageBackendId;
    private boolean immutable;
    private Instant retentionUntil;
    private boolean legalHoldEnabled;
    private String legalHoldReason;
    private String errorMessage;
    private Instant startedAt;
    private Instant completedAt;
    private Instant deletedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static BackupResponse fromEntity(Backup backup) {
        return BackupResponse.builder()
                .id(backup.getId())
                .sourceType(backup.getSourceType())
                .sourceId(backup.getSourceId())
                .scheduleId(backup.getScheduleId())
                .chainId(backup.getChainId())
                .sequenceNumber(backup.getSequenceNumber())
                .parentBackupId(backup.getParentBackupId())
                .backupMode(backup.getBackupMode())
                .modeReason(backup.getModeReason())
                .status(backup.getStatus())
                .sizeBytes(backup.getSizeBytes())
                .compressedSizeBytes(backup.getCompressedSizeBytes())
                .formattedSize(FormatUtils.formatBytes(backup.getSizeBytes()))
                .checksum(backup.getChecksum())
                .verified(backup.isVerified())
                .storagePath(backup.getStoragePath())
                .storageBackendId(backup.getStorageBackendId())
                .immutable(backup.isImmutable())
                .retentionUntil(backup.getRetentionUntil())
                .legalHoldEnabled(backup.isLegalHoldEnabled())
                .legalHoldReason(backup.getLegalHoldReason())
                .errorMessage(backup.getErrorMessage())
                .startedAt(backup.getStartedAt())
                .completedAt(backup.getCompletedAt())
                .deletedAt(backup.getDeletedAt())
                .createdAt(backup.getCreatedAt())
                .updatedAt(backup.getUpdatedAt())
                .build();
    }
}
