package com.labbackup.api.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualBackupRequest {

    @NotBlank
    @Pattern(regexp = "^(vm|container)$", message = "Source type must be vm or container")
    private String sourceType;

    @NotNull
    private Long sourceId;

    @NotNull
    private Long storageBackendId;

    /**
     * "full" forces a new chain, "incremental" retries the capability check before falling back,
     * null or "auto" lets the chain rules decide.
     */
    private String backupMode;
}
