package com.labbackup.api.model.dto;

import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
public class GlobalStatistics {

    private int totalChains;
    private int brokenChains;
    private int totalBackups;
    private int completedBackups;
    private int orphanedBackups;
    private long totalSizeBytes;
    private long totalCompressedSizeBytes;
    private long spaceSavedBytes;
    private String formattedTotalSize;
    private String formattedCompressedSize;
    private String formattedSpaceSaved;
    private double compressionRatio;

    /** Share of the original size saved by compression, in percent. */
    private double efficiencyPercent;

    public static GlobalStatistics from(List<ChainStatistics> chains, int brokenChains, int orphanedBackups) {
        long totalSize = chains.stream().mapToLong(ChainStatistics::getTotalSizeBytes).sum();
        long totalCompressed = chains.stream().mapToLong(ChainStatistics::getTotalCompressedSizeBytes).sum();
        long saved = chains.stream().mapToLong(ChainStatistics::getSpaceSavedBytes).sum();

        return GlobalStatistics.builder()
                .totalChains(chains.size())
                .brokenChains(brokenChains)
                .totalBackups(chains.stream().mapToInt(ChainStatistics::getBackupCount).sum())
                .completedBackups(chains.stream().mapToInt(ChainStatistics::getCompletedCount).sum())
                .orphanedBackups(orphanedBackups)
                .totalSizeBytes(totalSize)
                .totalCompressedSizeBytes(totalCompressed)
                .spaceSavedBytes(saved)
                .formattedTotalSize(FormatUtils.formatBytes(totalSize))
                .formattedCompressedSize(FormatUtils.formatBytes(totalCompressed))
                .formattedSpaceSaved(FormatUtils.formatBytes(saved))
                .compressionRatio(totalSize > 0 ? Math.round(totalCompressed * 100.0 / totalSize) / 100.0 : 1.0)
                .efficiencyPercent(totalSize > 0 ? Math.round(saved * 10000.0 / totalSize) / 100.0 : 0.0)
                .build();
    }
}
