package com.labbackup.api.service.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageUsage {

    private long usedBytes;

    /** 0 when the backend does not report a capacity. */
    private long capacityBytes;
}
