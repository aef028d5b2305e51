package com.labbackup.api.service.snapshot;

import com.labbackup.api.service.storage.ArtifactSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptureResult {

    private ArtifactSource artifact;
    private long sizeBytes;

    /** Checksum reported by the producer, if any. */
    private String checksum;

    /** Token the next incremental of this chain captures changes since. */
    private String newCheckpointToken;
}
