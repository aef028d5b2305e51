package com.labbackup.api.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised when a trigger arrives for a source that already has a pending or running backup.
 */
@Getter
public class BackupInProgressException extends IllegalStateException {

    private final String sourceType;
    private final Long sourceId;
    private final UUID activeBackupId;

    public BackupInProgressException(String sourceType, Long sourceId, UUID activeBackupId) {
        super("A backup is already in progress for " + sourceType + " " + sourceId
                + " (backup " + activeBackupId + "). Please wait for it to complete.");
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.activeBackupId = activeBackupId;
    }
}
