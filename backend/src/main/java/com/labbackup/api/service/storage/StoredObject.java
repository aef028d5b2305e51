package com.labbackup.api.service.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {

    /** Hex SHA-256 of the bytes as written. */
    private String checksum;
    private long sizeBytes;
}
