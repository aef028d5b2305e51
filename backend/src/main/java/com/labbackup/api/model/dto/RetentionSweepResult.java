package com.labbackup.api.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * What one retention sweep did for one source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionSweepResult {

    private String sourceType;
    private Long sourceId;

    @Builder.Default
    private List<UUID> deleted = new ArrayList<>();

    /**
     * Deletions that stayed delete_pending because storage did not confirm removal
     */
    @Builder.Default
    private List<UUID> failed = new ArrayList<>();

    /**
     * Candidates left alone because their state changed since evaluation
     */
    @Builder.Default
    private Map<UUID, String> skipped = new LinkedHashMap<>();

    @Builder.Default
    private Map<UUID, String> vetoed = new LinkedHashMap<>();

    @Builder.Default
    private Set<UUID> loadBearing = new LinkedHashSet<>();
}
