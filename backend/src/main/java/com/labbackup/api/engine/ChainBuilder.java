package com.labbackup.api.engine;

import com.labbackup.api.model.entity.Backup;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Decides whether the next backup of a source continues the current chain or starts a new one.
 * <p>
 * Works on explicit inputs only: the newest completed backup of the source, the date its chain
 * was started, the chain policy, today's date and the result of the incremental capability check.
 * Failed and cancelled backups must never be passed as the prior backup.
 */
@Slf4j
public class ChainBuilder {

    private final int defaultMaxChainLength;

    public ChainBuilder(int defaultMaxChainLength) {
        this.defaultMaxChainLength = defaultMaxChainLength;
    }

    /**
     * @param policy                 mode policy and chain overrides
     * @param prior                  newest completed backup of the source, or null if there is none
     * @param chainStartedOn         day the prior backup's chain was started, or null if unknown
     * @param today                  current date in the retention zone
     * @param incrementalSupported   whether the snapshot producer can capture incrementally
     */
    public ChainDecision decide(ChainPolicy policy, Backup prior, LocalDate chainStartedOn,
                                LocalDate today, boolean incrementalSupported) {
        requireKnownPolicy(policy);
        if (prior != null && !prior.isCompleted()) {
            throw new IllegalArgumentException("Prior backup " + prior.getId() + " is " + prior.getStatus()
                    + "; only completed backups can seed a chain");
        }

        String fullReason = newChainReason(policy, prior, chainStartedOn, today);
        if (fullReason != null) {
            return newChain(fullReason);
        }
        if (!incrementalSupported) {
            log.warn("Incremental capture unsupported for chain {}, starting a new full chain", prior.getChainId());
            return newChain(ChainDecision.REASON_INCREMENTAL_UNSUPPORTED);
        }
        return continueChain(prior);
    }

    /**
     * New full chain for a source whose current chain cannot be restored up to its newest backup.
     * A broken chain is never extended.
     */
    public ChainDecision startAfterBrokenChain(ChainPolicy policy, Backup prior) {
        requireKnownPolicy(policy);
        log.warn("Chain {} is not restorable through sequence {}, starting a new full chain",
                prior.getChainId(), prior.getSequenceNumber());
        return newChain(ChainDecision.REASON_CHAIN_BROKEN);
    }

    /**
     * Reason that forces a new chain regardless of capability check outcome, or null when the chain may continue.
     */
    String newChainReason(ChainPolicy policy, Backup prior, LocalDate chainStartedOn, LocalDate today) {
        if (prior == null) {
            return ChainDecision.REASON_FIRST_BACKUP;
        }
        if (policy.isForceFull()) {
            return ChainDecision.REASON_REQUESTED_FULL;
        }
        if (policy.isFullOnly()) {
            return ChainDecision.REASON_FULL_ONLY_POLICY;
        }
        if (prior.getSequenceNumber() + 1 >= effectiveMaxChainLength(policy)) {
            return ChainDecision.REASON_MAX_CHAIN_LENGTH;
        }
        if (isFullBackupDay(policy.getFullBackupDay(), today) && !today.equals(chainStartedOn)) {
            return ChainDecision.REASON_FULL_BACKUP_DAY;
        }
        if (prior.getCheckpointToken() == null || prior.getCheckpointToken().isBlank()) {
            return ChainDecision.REASON_MISSING_CHECKPOINT;
        }
        return null;
    }

    /**
     * True when a capability check result could still change the outcome, i.e. an incremental is otherwise allowed.
     */
    public boolean needsCapabilityCheck(ChainPolicy policy, Backup prior, LocalDate chainStartedOn, LocalDate today) {
        return newChainReason(policy, prior, chainStartedOn, today) == null;
    }

    int effectiveMaxChainLength(ChainPolicy policy) {
        Integer configured = policy.getMaxChainLength();
        if (configured != null && configured > 0) {
            return configured;
        }
        return defaultMaxChainLength > 0 ? defaultMaxChainLength : Integer.MAX_VALUE;
    }

    /**
     * Day-of-month anchors past the end of a short month fall on its last day.
     */
    static boolean isFullBackupDay(Integer fullBackupDay, LocalDate today) {
        if (fullBackupDay == null || fullBackupDay < 1) {
            return false;
        }
        int anchor = Math.min(fullBackupDay, today.lengthOfMonth());
        return today.getDayOfMonth() == anchor;
    }

    private static void requireKnownPolicy(ChainPolicy policy) {
        if (!ChainPolicy.isKnownPolicy(policy.getBackupModePolicy())) {
            throw new IllegalArgumentException("Unknown backup mode policy: " + policy.getBackupModePolicy());
        }
    }

    private ChainDecision newChain(String reason) {
        return ChainDecision.builder()
                .backupMode(Backup.MODE_FULL)
                .chainId(UUID.randomUUID())
                .sequenceNumber(0)
                .parentBackupId(null)
                .checkpointToken(null)
                .reason(reason)
                .build();
    }

    private ChainDecision continueChain(Backup prior) {
        return ChainDecision.builder()
                .backupMode(Backup.MODE_INCREMENTAL)
                .chainId(prior.getChainId())
                .sequenceNumber(prior.getSequenceNumber() + 1)
                .parentBackupId(prior.getId())
                .checkpointToken(prior.getCheckpointToken())
                .reason(ChainDecision.REASON_CHAIN_CONTINUED)
                .build();
    }
}
