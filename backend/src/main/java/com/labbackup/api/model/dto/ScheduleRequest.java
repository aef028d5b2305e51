package com.labbackup.api.model.dto;

import com.labbackup.api.model.entity.RetentionConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {

    @NotBlank
    @Size(max = 255)
    private String name;

    @NotBlank
    @Pattern(regexp = "^(vm|container)$", message = "Source type must be vm or container")
    private String sourceType;

    @NotNull
    private Long sourceId;

    @NotNull
    private Long storageBackendId;

    /**
     * Spring cron (6 fields) or classic 5-field cron, e.g. "0 2 * * *".
     */
    @NotBlank
    private String cronExpression;

    private Boolean enabled;

    @Pattern(regexp = "^(auto|full_only|incremental_preferred)$",
            message = "Backup mode policy must be auto, full_only or incremental_preferred")
    private String backupModePolicy;

    @Min(1)
    private Integer maxChainLength;

    @Min(1)
    @Max(31)
    private Integer fullBackupDay;

    @Valid
    private RetentionConfig retentionConfig;
}
