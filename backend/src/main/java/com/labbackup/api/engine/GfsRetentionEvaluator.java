package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.RetentionConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

/**
 * Grandfather-father-son retention over the completed backups of one source.
 * <p>
 * Tiers bucket by {@code completedAt} in the configured zone. Daily keeps the latest backup of
 * each day; weekly, monthly and yearly keep the first backup of each ISO week, month and year.
 * Candidates outside every tier are dropped from the delete list when vetoed by a protection
 * flag or when a kept, vetoed or in-flight backup depends on them.
 */
@Slf4j
public class GfsRetentionEvaluator {

    private static final Comparator<Backup> OLDEST_FIRST = Comparator
            .comparing(Backup::getCompletedAt)
            .thenComparing(Backup::getSequenceNumber)
            .thenComparing(b -> b.getId().toString());

    private static final Comparator<Backup> DELETE_ORDER = Comparator
            .comparing(Backup::getSequenceNumber, Comparator.reverseOrder())
            .thenComparing(Backup::getCompletedAt, Comparator.reverseOrder())
            .thenComparing(b -> b.getId().toString());

    private final ZoneId zone;
    private final ChainIntegrityChecker integrityChecker;

    public GfsRetentionEvaluator(ZoneId zone, ChainIntegrityChecker integrityChecker) {
        this.zone = zone;
        this.integrityChecker = integrityChecker;
    }

    /**
     * @param backups  backups of one source; anything not completed is ignored
     * @param inFlight pending or running backups of the same source, whose ancestors must survive
     * @param config   tier counts
     * @param now      reference instant for {@code retentionUntil} vetoes
     */
    public RetentionResult evaluate(Collection<Backup> backups, Collection<Backup> inFlight,
                                    RetentionConfig config, Instant now) {
        config.validate();

        List<Backup> completed = backups.stream()
                .filter(Backup::isCompleted)
                .filter(b -> b.getCompletedAt() != null)
                .sorted(OLDEST_FIRST)
                .toList();

        Map<UUID, Set<String>> keepReasons = new LinkedHashMap<>();
        markKept(keepReasons, latestPerDay(completed, config.getDaily()), RetentionResult.TIER_DAILY);
        markKept(keepReasons, firstPerPeriod(completed, this::isoWeek, config.getWeekly()), RetentionResult.TIER_WEEKLY);
        markKept(keepReasons, firstPerPeriod(completed, YearMonth::from, config.getMonthly()), RetentionResult.TIER_MONTHLY);
        markKept(keepReasons, firstPerPeriod(completed, LocalDate::getYear, config.getYearly()), RetentionResult.TIER_YEARLY);

        Map<UUID, String> vetoed = new LinkedHashMap<>();
        List<Backup> candidates = new ArrayList<>();
        for (Backup backup : completed) {
            if (keepReasons.containsKey(backup.getId())) {
                continue;
            }
            String veto = vetoReason(backup, now);
            if (veto != null) {
                log.info("Retention veto: backup {} kept ({})", backup.getId(), veto);
                vetoed.put(backup.getId(), veto);
            } else {
                candidates.add(backup);
            }
        }

        Set<UUID> protectedIds = new HashSet<>(keepReasons.keySet());
        protectedIds.addAll(vetoed.keySet());
        List<Backup> universe = new ArrayList<>(completed);
        for (Backup backup : inFlight) {
            if (backup.isInFlight()) {
                protectedIds.add(backup.getId());
                universe.add(backup);
            }
        }
        Set<UUID> ancestors = integrityChecker.findLoadBearing(universe, protectedIds);

        Set<UUID> loadBearing = new LinkedHashSet<>();
        List<Backup> delete = new ArrayList<>();
        for (Backup candidate : candidates) {
            if (ancestors.contains(candidate.getId())) {
                loadBearing.add(candidate.getId());
            } else {
                delete.add(candidate);
            }
        }
        delete.sort(DELETE_ORDER);

        Set<UUID> deleteIds = new HashSet<>();
        delete.forEach(b -> deleteIds.add(b.getId()));
        for (Backup backup : completed) {
            if (vetoed.containsKey(backup.getId())) {
                keepReasons.computeIfAbsent(backup.getId(), id -> new LinkedHashSet<>())
                        .add("veto:" + vetoed.get(backup.getId()));
            }
            if (loadBearing.contains(backup.getId())) {
                keepReasons.computeIfAbsent(backup.getId(), id -> new LinkedHashSet<>())
                        .add(RetentionResult.REASON_LOAD_BEARING);
            }
        }

        List<Backup> keep = completed.stream()
                .filter(b -> !deleteIds.contains(b.getId()))
                .sorted(OLDEST_FIRST.reversed())
                .toList();

        return RetentionResult.builder()
                .keep(keep)
                .delete(List.copyOf(delete))
                .vetoed(vetoed)
                .loadBearing(loadBearing)
                .keepReasons(keepReasons)
                .build();
    }

    /**
     * Protection flag that forbids deleting the backup, or null when none applies.
     */
    public static String vetoReason(Backup backup, Instant now) {
        if (backup.isLegalHoldEnabled()) {
            return RetentionResult.VETO_LEGAL_HOLD;
        }
        if (backup.isImmutable()) {
            return RetentionResult.VETO_IMMUTABLE;
        }
        if (backup.getRetentionUntil() != null && backup.getRetentionUntil().isAfter(now)) {
            return RetentionResult.VETO_RETENTION_UNTIL;
        }
        return null;
    }

    private List<Backup> latestPerDay(List<Backup> oldestFirst, int count) {
        if (count <= 0) {
            return List.of();
        }
        // Later entries overwrite earlier ones, leaving the latest backup of each day
        TreeMap<LocalDate, Backup> latest = new TreeMap<>();
        for (Backup backup : oldestFirst) {
            latest.put(localDate(backup), backup);
        }
        return mostRecent(new ArrayList<>(latest.values()), count);
    }

    private <K> List<Backup> firstPerPeriod(List<Backup> oldestFirst, Function<LocalDate, K> period, int count) {
        if (count <= 0) {
            return List.of();
        }
        Map<K, Backup> first = new LinkedHashMap<>();
        for (Backup backup : oldestFirst) {
            first.putIfAbsent(period.apply(localDate(backup)), backup);
        }
        return mostRecent(new ArrayList<>(first.values()), count);
    }

    private static List<Backup> mostRecent(List<Backup> oldestFirstBuckets, int count) {
        int from = Math.max(0, oldestFirstBuckets.size() - count);
        return oldestFirstBuckets.subList(from, oldestFirstBuckets.size());
    }

    private static void markKept(Map<UUID, Set<String>> keepReasons, List<Backup> kept, String tier) {
        for (Backup backup : kept) {
            keepReasons.computeIfAbsent(backup.getId(), id -> new LinkedHashSet<>()).add(tier);
        }
    }

    private String isoWeek(LocalDate date) {
        return date.get(IsoFields.WEEK_BASED_YEAR) + "-W" + date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    private LocalDate localDate(Backup backup) {
        return backup.getCompletedAt().atZone(zone).toLocalDate();
    }
}
