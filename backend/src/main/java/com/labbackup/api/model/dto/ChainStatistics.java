package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class ChainStatistics {

    private UUID chainId;
    private String sourceType;
    private Long sourceId;
    private int backupCount;
    private int completedCount;
    private int latestSequence;
    private Instant firstBackupAt;
    private Instant lastBackupAt;
    private long totalSizeBytes;
    private long totalCompressedSizeBytes;
    private String formattedTotalSize;
    private String formattedCompressedSize;

    /** Stored size over original size; 1.0 when nothing is compressed or sizes are unknown. */
    private double compressionRatio;

    /** Original size minus stored size, never negative. */
    private long spaceSavedBytes;

    /**
     * @param members chain members ordered by sequence number; deleted rows are ignored
     */
    public static ChainStatistics from(UUID chainId, List<Backup> members) {
        List<Backup> live = members.stream()
                .filter(b -> !Backup.STATUS_DELETED.equals(b.getStatus()))
                .toList();
        List<Backup> completed = live.stream().filter(Backup::isCompleted).toList();

        long totalSize = completed.stream()
                .map(Backup::getSizeBytes)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
        long totalCompressed = completed.stream()
                .mapToLong(b -> b.getCompressedSizeBytes() != null ? b.getCompressedSizeBytes()
                        : b.getSizeBytes() != null ? b.getSizeBytes() : 0L)
                .sum();
        double ratio = totalSize > 0 ? Math.round(totalCompressed * 100.0 / totalSize) / 100.0 : 1.0;

        Backup first = live.isEmpty() ? null : live.get(0);
        Backup last = live.isEmpty() ? null : live.get(live.size() - 1);

        return ChainStatistics.builder()
                .chainId(chainId)
                .sourceType(first != null ? first.getSourceType() : null)
                .sourceId(first != null ? first.getSourceId() : null)
                .backupCount(live.size())
                .completedCount(completed.size())
                .latestSequence(completed.stream().mapToInt(Backup::getSequenceNumber).max().orElse(-1))
                .firstBackupAt(first != null ? first.getCreatedAt() : null)
                .lastBackupAt(last != null ? last.getCreatedAt() : null)
                .totalSizeBytes(totalSize)
                .totalCompressedSizeBytes(totalCompressed)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .formattedCompressedSize(FormatUtils.formatBytes(totalCompressed))
                .compressionRatio(ratio)
                .spaceSavedBytes(Math.max(0L, totalSize - totalCompressed))
                .build();
    }
}
