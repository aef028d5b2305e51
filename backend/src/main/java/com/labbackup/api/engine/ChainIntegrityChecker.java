package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Validates the links of one chain and answers load-bearing questions.
 * <p>
 * Only completed members count as restore points. A break at sequence {@code n} (gap, duplicate or
 * bad parent link) caps restorability at {@code n - 1}; members before it stay restorable. An in-flight
 * member below the newest completed one is only a warning, but it caps restorability the same way.
 */
public class ChainIntegrityChecker {

    private static final Set<String> DEPENDENT_STATUSES = Set.of(
            Backup.STATUS_COMPLETED, Backup.STATUS_DELETE_PENDING,
            Backup.STATUS_PENDING, Backup.STATUS_RUNNING);

    /**
     * @param chainId      chain being checked
     * @param members      every row carrying this chain id, in any status
     * @param backupExists lookup for parent ids that are not members, to tell orphans from foreign links
     */
    public IntegrityReport check(UUID chainId, List<Backup> members, Predicate<UUID> backupExists) {
        Map<UUID, Backup> byId = indexById(members);
        List<IntegrityIssue> issues = new ArrayList<>();

        List<Backup> completed = members.stream()
                .filter(Backup::isCompleted)
                .sorted(Comparator.comparing(Backup::getSequenceNumber))
                .toList();

        if (completed.isEmpty()) {
            issues.add(IntegrityIssue.critical(IntegrityIssue.CODE_NO_COMPLETED_BACKUPS, null, null,
                    "Chain has no completed backups"));
            return buildReport(chainId, members, completed, issues, -1, -1);
        }

        int latest = completed.get(completed.size() - 1).getSequenceNumber();
        List<Backup> present = members.stream()
                .filter(m -> m.isCompleted() || m.isInFlight())
                .filter(m -> m.getSequenceNumber() <= latest)
                .toList();
        int restorableThrough = checkSequences(present, latest, issues);

        for (Backup backup : completed) {
            IntegrityIssue linkIssue = checkLink(chainId, backup, byId, backupExists);
            if (linkIssue != null) {
                issues.add(linkIssue);
                restorableThrough = Math.min(restorableThrough, backup.getSequenceNumber() - 1);
            }
        }

        for (Backup member : members) {
            if (member.isInFlight() && member.getSequenceNumber() < latest) {
                issues.add(IntegrityIssue.warning(IntegrityIssue.CODE_IN_FLIGHT_MID_CHAIN, member.getId(),
                        member.getSequenceNumber(),
                        "Backup at sequence " + member.getSequenceNumber() + " is still " + member.getStatus()
                                + " while later backups exist"));
                restorableThrough = Math.min(restorableThrough, member.getSequenceNumber() - 1);
            }
        }

        for (Backup backup : completed) {
            if (backup.getChecksum() == null) {
                issues.add(IntegrityIssue.warning(IntegrityIssue.CODE_CHECKSUM_MISSING, backup.getId(),
                        backup.getSequenceNumber(), "Backup has no checksum"));
            } else if (!backup.isVerified()) {
                issues.add(IntegrityIssue.warning(IntegrityIssue.CODE_CHECKSUM_UNVERIFIED, backup.getId(),
                        backup.getSequenceNumber(), "Checksum has not been verified"));
            }
        }

        return buildReport(chainId, members, completed, issues, restorableThrough, latest);
    }

    /**
     * Ids of every backup that is an ancestor of one of {@code protectedIds}, following parent links
     * through {@code members}. The protected backups themselves are not included unless they are
     * also an ancestor of another protected backup.
     */
    public Set<UUID> findLoadBearing(Collection<Backup> members, Collection<UUID> protectedIds) {
        Map<UUID, Backup> byId = indexById(members);
        Set<UUID> ancestors = new HashSet<>();
        for (UUID protectedId : protectedIds) {
            Backup current = byId.get(protectedId);
            Set<UUID> visited = new HashSet<>();
            while (current != null && current.getParentBackupId() != null && visited.add(current.getId())) {
                UUID parentId = current.getParentBackupId();
                if (!ancestors.add(parentId)) {
                    // Already walked from here
                    break;
                }
                current = byId.get(parentId);
            }
        }
        return ancestors;
    }

    /**
     * A backup is load-bearing while any completed, delete-pending or in-flight descendant
     * in its chain still depends on it.
     */
    public boolean isLoadBearing(Backup backup, Collection<Backup> chainMembers) {
        Set<UUID> dependents = chainMembers.stream()
                .filter(m -> !m.getId().equals(backup.getId()))
                .filter(m -> DEPENDENT_STATUSES.contains(m.getStatus()))
                .map(Backup::getId)
                .collect(Collectors.toSet());
        return findLoadBearing(chainMembers, dependents).contains(backup.getId());
    }

    /**
     * Descendants of {@code backup} among {@code chainMembers}, deepest first.
     */
    public List<Backup> findDescendants(Backup backup, Collection<Backup> chainMembers) {
        Map<UUID, Backup> byId = indexById(chainMembers);
        List<Backup> descendants = new ArrayList<>();
        for (Backup member : chainMembers) {
            if (member.getId().equals(backup.getId())) {
                continue;
            }
            Backup current = byId.get(member.getParentBackupId());
            Set<UUID> visited = new HashSet<>();
            while (current != null && visited.add(current.getId())) {
                if (current.getId().equals(backup.getId())) {
                    descendants.add(member);
                    break;
                }
                current = byId.get(current.getParentBackupId());
            }
        }
        descendants.sort(Comparator.comparing(Backup::getSequenceNumber).reversed());
        return descendants;
    }

    /**
     * @param present completed and in-flight members up to {@code latest}; an in-flight row fills its slot
     */
    private int checkSequences(List<Backup> present, int latest, List<IntegrityIssue> issues) {
        Map<Integer, List<Backup>> bySequence = present.stream()
                .collect(Collectors.groupingBy(Backup::getSequenceNumber, TreeMap::new, Collectors.toList()));

        int contiguousEnd = latest;
        boolean broken = false;
        for (int seq = 0; seq <= latest; seq++) {
            List<Backup> atSequence = bySequence.get(seq);
            if (atSequence == null) {
                issues.add(IntegrityIssue.critical(IntegrityIssue.CODE_MISSING_SEQUENCE, null, seq,
                        "Sequence " + seq + " is missing"));
            } else if (atSequence.size() > 1) {
                issues.add(IntegrityIssue.critical(IntegrityIssue.CODE_DUPLICATE_SEQUENCE, atSequence.get(1).getId(), seq,
                        atSequence.size() + " backups share sequence " + seq));
            } else {
                continue;
            }
            if (!broken) {
                contiguousEnd = seq - 1;
                broken = true;
            }
        }
        return contiguousEnd;
    }

    private IntegrityIssue checkLink(UUID chainId, Backup backup, Map<UUID, Backup> byId,
                                     Predicate<UUID> backupExists) {
        int seq = backup.getSequenceNumber();
        UUID parentId = backup.getParentBackupId();

        if (seq == 0) {
            if (!backup.isFull() || parentId != null) {
                return IntegrityIssue.critical(IntegrityIssue.CODE_INVALID_FULL, backup.getId(), seq,
                        "Sequence 0 must be a full backup without a parent");
            }
            return null;
        }
        if (backup.isFull()) {
            return IntegrityIssue.critical(IntegrityIssue.CODE_INVALID_FULL, backup.getId(), seq,
                    "Full backup found at sequence " + seq);
        }
        if (parentId == null) {
            return IntegrityIssue.critical(IntegrityIssue.CODE_MISSING_PARENT_LINK, backup.getId(), seq,
                    "Incremental at sequence " + seq + " has no parent");
        }

        Backup parent = byId.get(parentId);
        if (parent == null || !chainId.equals(parent.getChainId())) {
            if (parent != null || backupExists.test(parentId)) {
                return IntegrityIssue.critical(IntegrityIssue.CODE_FOREIGN_PARENT, backup.getId(), seq,
                        "Parent " + parentId + " belongs to another chain");
            }
            return IntegrityIssue.critical(IntegrityIssue.CODE_ORPHANED_INCREMENTAL, backup.getId(), seq,
                    "Parent " + parentId + " no longer exists");
        }
        if (parent.getSequenceNumber() != seq - 1) {
            return IntegrityIssue.critical(IntegrityIssue.CODE_PARENT_SEQUENCE_MISMATCH, backup.getId(), seq,
                    "Parent has sequence " + parent.getSequenceNumber() + ", expected " + (seq - 1));
        }
        if (!parent.isCompleted() && !parent.isInFlight()) {
            return IntegrityIssue.critical(IntegrityIssue.CODE_PARENT_NOT_COMPLETED, backup.getId(), seq,
                    "Parent at sequence " + parent.getSequenceNumber() + " is " + parent.getStatus());
        }
        return null;
    }

    private IntegrityReport buildReport(UUID chainId, List<Backup> members, List<Backup> completed,
                                        List<IntegrityIssue> issues, int restorableThrough, int latest) {
        List<IntegrityIssue> ordered = new ArrayList<>(issues);
        ordered.sort(Comparator.comparing(IntegrityIssue::getSequenceNumber,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        boolean critical = ordered.stream().anyMatch(IntegrityIssue::isCritical);

        int total = (int) members.stream()
                .filter(m -> !Backup.STATUS_DELETED.equals(m.getStatus()))
                .count();

        return IntegrityReport.builder()
                .chainId(chainId)
                .valid(ordered.isEmpty())
                .restorable(!critical)
                .totalBackups(total)
                .completedBackups(completed.size())
                .restorableThroughSequence(restorableThrough)
                .latestSequence(latest)
                .issues(ordered)
                .build();
    }

    private static Map<UUID, Backup> indexById(Collection<Backup> backups) {
        Map<UUID, Backup> byId = new HashMap<>();
        for (Backup backup : backups) {
            byId.put(backup.getId(), backup);
        }
        return byId;
    }
}
