package com.labbackup.api.service.snapshot;

/**
 * Hypervisor-side capture of VM and container disks.
 */
public interface SnapshotProducer {

    /**
     * Whether the source can currently be captured incrementally.
     */
    boolean checkIncrementalCapability(SnapshotSource source);

    /**
     * @param backupMode      full or incremental
     * @param checkpointToken parent's checkpoint for incrementals, null for full captures
     * @throws com.labbackup.api.exception.SnapshotCaptureFailedException when the capture fails
     */
    CaptureResult capture(SnapshotSource source, String backupMode, String checkpointToken);
}
