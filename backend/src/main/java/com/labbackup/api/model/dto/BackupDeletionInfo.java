package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Preview of a manual deletion: the backup, the incrementals that depend on it, and whether
 * anything blocks the delete.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupDeletionInfo {

    private BackupResponse backup;

    private UUID chainId;

    /**
     * Dependents deleted first when the deletion is confirmed, deepest first
     */
    private List<BackupResponse> dependentBackups;

    private int totalCount;

    private long totalSizeBytes;

    private String formattedTotalSize;

    /**
     * True if there are dependent backups
     */
    private boolean requiresConfirmation;

    /**
     * Why the deletion cannot proceed (protection flag or in-flight dependent); null if it can
     */
    private String blockedReason;

    private String warningMessage;

    /**
     * Highest sequence of the chain that stays restorable afterwards; -1 when the chain's full goes
     */
    private int remainingRestorableSequence;

    public static BackupDeletionInfo from(Backup backup, List<Backup> dependentBackups, String blockedReason) {
        List<BackupResponse> dependentResponses = dependentBackups.stream()
                .map(BackupResponse::fromEntity)
                .toList();

        long totalSize = backup.getSizeBytes() != null ? backup.getSizeBytes() : 0;
        totalSize += dependentBackups.stream()
                .mapToLong(b -> b.getSizeBytes() != null ? b.getSizeBytes() : 0)
                .sum();

        int totalCount = 1 + dependentBackups.size();
        boolean requiresConfirmation = !dependentBackups.isEmpty();

        String warning = null;
        if (requiresConfirmation) {
            warning = String.format(
                    "This %s backup (sequence %d) has %d dependent backup(s) that will also be deleted. " +
                    "Restore points after sequence %d in this chain will be lost.",
                    backup.getBackupMode(),
                    backup.getSequenceNumber(),
                    dependentBackups.size(),
                    backup.getSequenceNumber() - 1
            );
        }

        return BackupDeletionInfo.builder()
                .backup(BackupResponse.fromEntity(backup))
                .chainId(backup.getChainId())
                .remainingRestorableSequence(backup.getSequenceNumber() - 1)
                .dependentBackups(dependentResponses)
                .totalCount(totalCount)
                .totalSizeBytes(totalSize)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .requiresConfirmation(requiresConfirmation)
                .blockedReason(blockedReason)
                .warningMessage(warning)
                .build();
    }

    public boolean isBlocked() {
        return blockedReason != null;
    }
}
