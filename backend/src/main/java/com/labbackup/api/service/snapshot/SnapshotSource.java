package com.labbackup.api.service.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * What to capture: a VM or container, plus the schedule state the producer keeps between runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotSource {

    private String sourceType;
    private Long sourceId;
    private UUID scheduleId;
    private String checkpointName;
}
