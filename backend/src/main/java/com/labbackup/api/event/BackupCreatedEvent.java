package com.labbackup.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Event published when a pending backup row, with its chain identity, is created.
 * Capture starts only after the creating transaction commits.
 */
@Getter
public class BackupCreatedEvent extends ApplicationEvent {

    private final UUID backupId;

    public BackupCreatedEvent(Object source, UUID backupId) {
        super(source);
        this.backupId = backupId;
    }
}
