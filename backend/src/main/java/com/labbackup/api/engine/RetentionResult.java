package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of a retention evaluation for one source.
 * <p>
 * {@code keep} and {@code delete} partition the completed backups. {@code keep} holds tier matches
 * plus vetoed and load-bearing backups; {@code keepReasons} says why each one stays.
 * {@code delete} is in execution order: dependents before their parents.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionResult {

    public static final String TIER_DAILY = "daily";
    public static final String TIER_WEEKLY = "weekly";
    public static final String TIER_MONTHLY = "monthly";
    public static final String TIER_YEARLY = "yearly";
    public static final String REASON_LOAD_BEARING = "load_bearing";

    // Veto reasons
    public static final String VETO_LEGAL_HOLD = "legal_hold";
    public static final String VETO_IMMUTABLE = "immutable";
    public static final String VETO_RETENTION_UNTIL = "retention_until";

    private List<Backup> keep;
    private List<Backup> delete;
    private Map<UUID, String> vetoed;
    private Set<UUID> loadBearing;
    private Map<UUID, Set<String>> keepReasons;

    public List<UUID> getKeepIds() {
        return keep.stream().map(Backup::getId).toList();
    }

    public List<UUID> getDeleteIds() {
        return delete.stream().map(Backup::getId).toList();
    }
}
