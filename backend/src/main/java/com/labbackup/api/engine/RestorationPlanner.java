package com.labbackup.api.engine;

import com.labbackup.api.exception.ChainBrokenException;
import com.labbackup.api.model.entity.Backup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the ordered artifact list that rebuilds a target backup.
 * <p>
 * Walks parent links from the target back to sequence 0 and reverses the path. Any broken link,
 * or an integrity report that places the target beyond a critical break, raises
 * {@link ChainBrokenException} with a fallback plan to the last restorable sequence when one exists.
 */
public class RestorationPlanner {

    private final long throughputBytesPerSecond;

    public RestorationPlanner(long throughputBytesPerSecond) {
        this.throughputBytesPerSecond = throughputBytesPerSecond;
    }

    /**
     * @param target       completed backup to restore
     * @param chainMembers every row of the target's chain
     * @param report       integrity report of the same chain, or null to rely on the link walk only
     */
    public RestorationPlan plan(Backup target, List<Backup> chainMembers, IntegrityReport report) {
        if (!target.isCompleted()) {
            throw new IllegalStateException("Backup " + target.getId() + " is " + target.getStatus()
                    + "; only completed backups can be restored");
        }

        Map<UUID, Backup> byId = new HashMap<>();
        chainMembers.forEach(b -> byId.put(b.getId(), b));
        byId.put(target.getId(), target);

        if (report != null && !report.isRestorableTo(target.getSequenceNumber())) {
            String brokenLink = report.getFirstCriticalIssue()
                    .map(IntegrityIssue::getMessage)
                    .orElse("target lies beyond the last restorable sequence");
            throw broken(target, brokenLink, report.getRestorableThroughSequence(), chainMembers, byId);
        }

        List<Backup> path = new ArrayList<>();
        String brokenLink = walk(target, byId, path);
        if (brokenLink != null) {
            int lastRestorable = report != null
                    ? Math.min(report.getRestorableThroughSequence(), target.getSequenceNumber() - 1)
                    : -1;
            throw broken(target, brokenLink, lastRestorable, chainMembers, byId);
        }
        return toPlan(target, path);
    }

    /**
     * Collects the path from {@code target} back to sequence 0 into {@code path}, newest first.
     * Returns a description of the first broken link, or null when the walk reached a valid full backup.
     */
    private String walk(Backup target, Map<UUID, Backup> byId, List<Backup> path) {
        Set<Integer> seen = new HashSet<>();
        Backup current = target;
        while (true) {
            int seq = current.getSequenceNumber();
            if (!seen.add(seq)) {
                return "sequence " + seq + " appears twice on the path";
            }
            path.add(current);
            if (seq == 0) {
                if (!current.isFull() || current.getParentBackupId() != null) {
                    return "sequence 0 is not a full backup";
                }
                return null;
            }

            UUID parentId = current.getParentBackupId();
            if (parentId == null) {
                return "backup at sequence " + seq + " has no parent";
            }
            Backup parent = byId.get(parentId);
            if (parent == null) {
                return "parent " + parentId + " of sequence " + seq + " not found";
            }
            if (!target.getChainId().equals(parent.getChainId())) {
                return "parent " + parentId + " of sequence " + seq + " belongs to chain " + parent.getChainId();
            }
            if (parent.getSequenceNumber() != seq - 1) {
                return "parent of sequence " + seq + " has sequence " + parent.getSequenceNumber();
            }
            if (!parent.isCompleted()) {
                return "parent at sequence " + parent.getSequenceNumber() + " is " + parent.getStatus();
            }
            current = parent;
        }
    }

    private ChainBrokenException broken(Backup target, String brokenLink, int lastRestorable,
                                        List<Backup> chainMembers, Map<UUID, Backup> byId) {
        return new ChainBrokenException(target.getChainId(), target.getId(), brokenLink, lastRestorable,
                fallbackPlan(target, lastRestorable, chainMembers, byId));
    }

    private RestorationPlan fallbackPlan(Backup target, int lastRestorable, List<Backup> chainMembers,
                                         Map<UUID, Backup> byId) {
        if (lastRestorable < 0) {
            return null;
        }
        List<Backup> atSequence = chainMembers.stream()
                .filter(Backup::isCompleted)
                .filter(b -> b.getSequenceNumber() == lastRestorable)
                .toList();
        if (atSequence.size() != 1 || atSequence.get(0).getId().equals(target.getId())) {
            return null;
        }
        List<Backup> path = new ArrayList<>();
        if (walk(atSequence.get(0), byId, path) != null) {
            return null;
        }
        return toPlan(atSequence.get(0), path);
    }

    private RestorationPlan toPlan(Backup target, List<Backup> newestFirstPath) {
        List<Backup> applyOrder = new ArrayList<>(newestFirstPath);
        Collections.reverse(applyOrder);
        List<RestorationStep> steps = new ArrayList<>();
        for (int i = 0; i < applyOrder.size(); i++) {
            steps.add(RestorationStep.of(i + 1, applyOrder.get(i)));
        }
        return RestorationPlan.of(target.getId(), target.getChainId(), target.getSequenceNumber(),
                steps, throughputBytesPerSecond);
    }
}
