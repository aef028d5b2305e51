package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Chain identity chosen for a new backup, plus the reason behind the mode.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainDecision {

    public static final String REASON_FIRST_BACKUP = "first_backup";
    public static final String REASON_FULL_ONLY_POLICY = "full_only_policy";
    public static final String REASON_REQUESTED_FULL = "requested_full";
    public static final String REASON_MAX_CHAIN_LENGTH = "max_chain_length";
    public static final String REASON_FULL_BACKUP_DAY = "full_backup_day";
    public static final String REASON_MISSING_CHECKPOINT = "missing_checkpoint";
    public static final String REASON_INCREMENTAL_UNSUPPORTED = "incremental_unsupported";
    public static final String REASON_CHAIN_BROKEN = "chain_broken";
    public static final String REASON_CHAIN_CONTINUED = "chain_continued";

    private String backupMode;
    private UUID chainId;
    private int sequenceNumber;
    private UUID parentBackupId;

    /** Checkpoint of the parent to capture changes since; null for full backups. */
    private String checkpointToken;

    private String reason;

    public boolean isFull() {
        return Backup.MODE_FULL.equals(backupMode);
    }
}
