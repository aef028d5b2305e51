package com.labbackup.api.engine;

import com.labbackup.api.util.FormatUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Ordered list of artifacts that rebuilds a target backup: the chain's full backup first,
 * then every incremental up to and including the target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RestorationPlan {

    private UUID targetBackupId;
    private UUID chainId;
    private int targetSequence;
    private List<RestorationStep> steps;
    private long totalSizeBytes;
    private String formattedTotalSize;
    private long estimatedSeconds;
    private String formattedEstimate;

    public static RestorationPlan of(UUID targetBackupId, UUID chainId, int targetSequence,
                                     List<RestorationStep> steps, long throughputBytesPerSecond) {
        long total = steps.stream().mapToLong(RestorationStep::getSizeBytes).sum();
        long seconds = throughputBytesPerSecond > 0
                ? (total + throughputBytesPerSecond - 1) / throughputBytesPerSecond
                : 0;
        return RestorationPlan.builder()
                .targetBackupId(targetBackupId)
                .chainId(chainId)
                .targetSequence(targetSequence)
                .steps(List.copyOf(steps))
                .totalSizeBytes(total)
                .formattedTotalSize(FormatUtils.formatBytes(total))
                .estimatedSeconds(seconds)
                .formattedEstimate(FormatUtils.formatDuration(seconds))
                .build();
    }

    public int getStepCount() {
        return steps != null ? steps.size() : 0;
    }
}
