package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Backups of a source or chain with storage totals. Sizes count the stored (compressed) artifact
 * where one is known.
 */
@Data
@Builder
@AllArgsConstructor
public class BackupListResponse {

    private List<BackupResponse> backups;
    private int count;
    private int completedCount;
    private long totalStoredBytes;
    private String formattedTotalStored;

    public static BackupListResponse fromEntities(List<Backup> backups) {
        long stored = backups.stream()
                .filter(b -> !Backup.STATUS_DELETED.equals(b.getStatus()))
                .mapToLong(BackupListResponse::storedBytes)
                .sum();

        return BackupListResponse.builder()
                .backups(backups.stream().map(BackupResponse::fromEntity).toList())
                .count(backups.size())
                .completedCount((int) backups.stream().filter(Backup::isCompleted).count())
                .totalStoredBytes(stored)
                .formattedTotalStored(FormatUtils.formatBytes(stored))
                .build();
    }

    private static long storedBytes(Backup backup) {
        if (backup.getCompressedSizeBytes() != null) {
            return backup.getCompressedSizeBytes();
        }
        return backup.getSizeBytes() != null ? backup.getSizeBytes() : 0;
    }
}
