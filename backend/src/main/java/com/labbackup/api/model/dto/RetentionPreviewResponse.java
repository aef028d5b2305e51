package com.labbackup.api.model.dto;

import com.labbackup.api.engine.RetentionResult;
import com.labbackup.api.model.entity.RetentionConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
@AllArgsConstructor
public class RetentionPreviewResponse {

    private String sourceType;
    private Long sourceId;
    private RetentionConfig retentionConfig;
    private List<BackupResponse> keep;

    /** In deletion order. */
    private List<BackupResponse> delete;
    private Map<UUID, Set<String>> keepReasons;
    private Map<UUID, String> vetoed;
    private Set<UUID> loadBearing;

    public static RetentionPreviewResponse from(String sourceType, Long sourceId, RetentionConfig config,
                                                RetentionResult result) {
        return RetentionPreviewResponse.builder()
                .sourceType(sourceType)
                .sourceId(sourceId)
                .retentionConfig(config)
                .keep(result.getKeep().stream().map(BackupResponse::fromEntity).toList())
                .delete(result.getDelete().stream().map(BackupResponse::fromEntity).toList())
                .keepReasons(result.getKeepReasons())
                .vetoed(result.getVetoed())
                .loadBearing(result.getLoadBearing())
                .build();
    }
}
