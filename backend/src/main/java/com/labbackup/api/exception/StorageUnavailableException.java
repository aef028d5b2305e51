package com.labbackup.api.exception;

import lombok.Getter;

/**
 * Transient storage backend failure. Retried with backoff at the storage gateway boundary.
 */
@Getter
public class StorageUnavailableException extends RuntimeException {

    private final Long backendId;

    public StorageUnavailableException(Long backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }
}
