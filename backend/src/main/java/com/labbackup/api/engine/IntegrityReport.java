package com.labbackup.api.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Result of checking one chain. {@code valid} means no issues at all, {@code restorable} means
 * no critical issue. {@code restorableThroughSequence} is -1 when nothing can be restored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntegrityReport {

    private UUID chainId;
    private boolean valid;
    private boolean restorable;
    private int totalBackups;
    private int completedBackups;
    private int restorableThroughSequence;
    private int latestSequence;
    private List<IntegrityIssue> issues;

    public boolean isRestorableTo(int sequenceNumber) {
        return sequenceNumber >= 0 && sequenceNumber <= restorableThroughSequence;
    }

    @JsonIgnore
    public Optional<IntegrityIssue> getFirstCriticalIssue() {
        return issues.stream().filter(IntegrityIssue::isCritical).findFirst();
    }

    public long getCriticalCount() {
        return issues.stream().filter(IntegrityIssue::isCritical).count();
    }

    public long getWarningCount() {
        return issues.size() - getCriticalCount();
    }
}
