package com.labbackup.api.engine;

import com.labbackup.api.model.entity.BackupSchedule;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inputs that steer full-vs-incremental selection for one backup request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainPolicy {

    @Builder.Default
    private String backupModePolicy = BackupSchedule.POLICY_AUTO;

    /** Null or non-positive means the configured default. */
    private Integer maxChainLength;

    /** Day of month (1-31) that forces a new chain; null disables. */
    private Integer fullBackupDay;

    /** Set for manual "full" requests. */
    private boolean forceFull;

    public static ChainPolicy fromSchedule(BackupSchedule schedule) {
        return ChainPolicy.builder()
                .backupModePolicy(schedule.getBackupModePolicy())
                .maxChainLength(schedule.getMaxChainLength())
                .fullBackupDay(schedule.getFullBackupDay())
                .build();
    }

    public boolean isFullOnly() {
        return BackupSchedule.POLICY_FULL_ONLY.equals(backupModePolicy);
    }

    public boolean isIncrementalPreferred() {
        return BackupSchedule.POLICY_INCREMENTAL_PREFERRED.equals(backupModePolicy);
    }

    public static boolean isKnownPolicy(String policy) {
        return BackupSchedule.POLICY_AUTO.equals(policy)
                || BackupSchedule.POLICY_FULL_ONLY.equals(policy)
                || BackupSchedule.POLICY_INCREMENTAL_PREFERRED.equals(policy);
    }
}
