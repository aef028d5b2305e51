package com.labbackup.api.service.snapshot;

import com.labbackup.api.exception.SnapshotCaptureFailedException;
import lombok.extern.slf4j.Slf4j;

/**
 * Stand-in used until a hypervisor integration registers its own {@link SnapshotProducer} bean.
 */
@Slf4j
public class UnconfiguredSnapshotProducer implements SnapshotProducer {

    @Override
    public boolean checkIncrementalCapability(SnapshotSource source) {
        return false;
    }

    @Override
    public CaptureResult capture(SnapshotSource source, String backupMode, String checkpointToken) {
        log.warn("No snapshot producer configured, cannot capture {} {}", source.getSourceType(), source.getSourceId());
        throw new SnapshotCaptureFailedException("No snapshot producer configured for "
                + source.getSourceType() + " " + source.getSourceId());
    }
}
