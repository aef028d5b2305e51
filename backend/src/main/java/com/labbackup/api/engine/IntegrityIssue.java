package com.labbackup.api.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityIssue {

    // Severities
    public static final String SEVERITY_CRITICAL = "critical";
    public static final String SEVERITY_WARNING = "warning";

    // Issue codes
    public static final String CODE_NO_COMPLETED_BACKUPS = "no_completed_backups";
    public static final String CODE_MISSING_SEQUENCE = "missing_sequence";
    public static final String CODE_DUPLICATE_SEQUENCE = "duplicate_sequence";
    public static final String CODE_INVALID_FULL = "invalid_full_backup";
    public static final String CODE_MISSING_PARENT_LINK = "missing_parent_link";
    public static final String CODE_ORPHANED_INCREMENTAL = "orphaned_incremental";
    public static final String CODE_FOREIGN_PARENT = "parent_in_other_chain";
    public static final String CODE_PARENT_SEQUENCE_MISMATCH = "parent_sequence_mismatch";
    public static final String CODE_PARENT_NOT_COMPLETED = "parent_not_completed";
    public static final String CODE_IN_FLIGHT_MID_CHAIN = "in_flight_mid_chain";
    public static final String CODE_CHECKSUM_UNVERIFIED = "checksum_unverified";
    public static final String CODE_CHECKSUM_MISSING = "checksum_missing";

    private String severity;
    private String code;
    private UUID backupId;
    private Integer sequenceNumber;
    private String message;

    public boolean isCritical() {
        return SEVERITY_CRITICAL.equals(severity);
    }

    static IntegrityIssue critical(String code, UUID backupId, Integer sequenceNumber, String message) {
        return new IntegrityIssue(SEVERITY_CRITICAL, code, backupId, sequenceNumber, message);
    }

    static IntegrityIssue warning(String code, UUID backupId, Integer sequenceNumber, String message) {
        return new IntegrityIssue(SEVERITY_WARNING, code, backupId, sequenceNumber, message);
    }
}
