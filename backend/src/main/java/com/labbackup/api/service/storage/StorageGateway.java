package com.labbackup.api.service.storage;

import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Object storage for backup artifacts, addressed by backend id and path.
 * <p>
 * Implementations raise {@link com.labbackup.api.exception.StorageUnavailableException} for
 * transient failures once their own retries are exhausted.
 */
public interface StorageGateway {

    StoredObject put(Long backendId, String path, ArtifactSource content, long contentLength,
                     Map<String, String> metadata);

    InputStream get(Long backendId, String path);

    /**
     * @return true when the object was removed or was already absent
     */
    boolean delete(Long backendId, String path);

    List<String> list(Long backendId, String prefix);

    StorageUsage usage(Long backendId);
}
