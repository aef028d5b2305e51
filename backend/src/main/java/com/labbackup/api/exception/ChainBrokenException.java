package com.labbackup.api.exception;

import com.labbackup.api.engine.RestorationPlan;
import lombok.Getter;

import java.util.UUID;

/**
 * A restore target cannot be reached because its chain has a broken link.
 * Carries the last sequence number that can still be restored safely and, when one exists,
 * a plan up to that point.
 */
@Getter
public class ChainBrokenException extends RuntimeException {

    private final UUID chainId;
    private final UUID targetBackupId;
    private final String brokenLink;
    private final int lastRestorableSequence;
    private final RestorationPlan fallbackPlan;

    public ChainBrokenException(UUID chainId, UUID targetBackupId, String brokenLink,
                                int lastRestorableSequence, RestorationPlan fallbackPlan) {
        super("Chain " + chainId + " is broken: " + brokenLink
                + (lastRestorableSequence >= 0
                        ? " (restorable up to sequence " + lastRestorableSequence + ")"
                        : " (nothing restorable)"));
        this.chainId = chainId;
        this.targetBackupId = targetBackupId;
        this.brokenLink = brokenLink;
        this.lastRestorableSequence = lastRestorableSequence;
        this.fallbackPlan = fallbackPlan;
    }

    public boolean hasFallbackPlan() {
        return fallbackPlan != null;
    }
}
