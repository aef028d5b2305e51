package com.labbackup.api.service.storage;

import java.io.IOException;
import java.io.InputStream;

/**
 * Re-openable artifact content. Each call returns a fresh stream positioned at the start,
 * so an upload can be retried after a transient storage failure.
 */
@FunctionalInterface
public interface ArtifactSource {

    InputStream open() throws IOException;
}
