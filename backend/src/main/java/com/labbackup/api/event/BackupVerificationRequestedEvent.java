package com.labbackup.api.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.UUID;

@Getter
public class BackupVerificationRequestedEvent extends ApplicationEvent {

    private final UUID backupId;

    public BackupVerificationRequestedEvent(Object source, UUID backupId) {
        super(source);
        this.backupId = backupId;
    }
}
