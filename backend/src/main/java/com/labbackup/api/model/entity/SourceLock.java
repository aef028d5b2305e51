package com.labbackup.api.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One row per backup source. Locked FOR UPDATE while a new backup gets its chain identity,
 * so concurrent triggers for the same source serialize on it.
 */
@Entity
@Table(name = "source_locks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SourceLock {

    @Id
    @Column(name = "lock_key", length = 100)
    private String lockKey;

    @Column(name = "source_type", nullable = false, length = 20)
    private String sourceType;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "last_acquired_at")
    private Instant lastAcquiredAt;

    public static String keyFor(String sourceType, Long sourceId) {
        return sourceType + ":" + sourceId;
    }
}
