package com.labbackup.api.exception;

/**
 * The snapshot producer could not capture the source. The backup row is marked failed
 * and the next scheduled trigger tries again.
 */
public class SnapshotCaptureFailedException extends RuntimeException {

    public SnapshotCaptureFailedException(String message) {
        super(message);
    }

    public SnapshotCaptureFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
