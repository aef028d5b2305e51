package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One artifact to apply during a restore, in application order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestorationStep {

    public static final String ACTION_RESTORE_FULL = "restore_full";
    public static final String ACTION_APPLY_INCREMENTAL = "apply_incremental";

    private int stepNumber;
    private UUID backupId;
    private String backupMode;
    private int sequenceNumber;
    private String action;
    private Long storageBackendId;
    private String storagePath;
    private long sizeBytes;

    /** Bytes to fetch from storage; null when the artifact is stored uncompressed or the size is unknown. */
    private Long compressedSizeBytes;

    private String checksum;

    public static RestorationStep of(int stepNumber, Backup backup) {
        return RestorationStep.builder()
                .stepNumber(stepNumber)
                .backupId(backup.getId())
                .backupMode(backup.getBackupMode())
                .sequenceNumber(backup.getSequenceNumber())
                .action(backup.isFull() ? ACTION_RESTORE_FULL : ACTION_APPLY_INCREMENTAL)
                .storageBackendId(backup.getStorageBackendId())
                .storagePath(backup.getStoragePath())
                .sizeBytes(backup.getSizeBytes() != null ? backup.getSizeBytes() : 0L)
                .compressedSizeBytes(backup.getCompressedSizeBytes())
                .checksum(backup.getChecksum())
                .build();
    }
}
