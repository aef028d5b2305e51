package com.labbackup.api.service;

import com.labbackup.api.engine.RestorationStep;

import java.io.IOException;
import java.io.InputStream;

/**
 * Receives restore artifacts in plan order, e.g. to write them back to a hypervisor.
 * <p>
 * Every artifact has passed its checksum before the first call. If a later re-read no longer
 * matches, the restore fails with an {@link IllegalStateException} after that step was applied,
 * and the sink must treat the target as incomplete.
 */
@FunctionalInterface
public interface RestoreSink {

    void apply(RestorationStep step, InputStream artifact) throws IOException;
}
