package com.labbackup.api.event;

import com.labbackup.api.service.BackupService;
import com.labbackup.api.service.VerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Starts async work only after the originating transaction commits, so a capture or verification
 * never runs against a row that was rolled back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AsyncOperationEventListener {

    private final BackupService backupService;
    private final VerificationService verificationService;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleBackupCreated(BackupCreatedEvent event) {
        log.debug("Starting capture for backup {}", event.getBackupId());
        backupService.executeBackupAsync(event.getBackupId());
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleVerificationRequested(BackupVerificationRequestedEvent event) {
        log.debug("Starting verification of backup {}", event.getBackupId());
        verificationService.verifyBackupAsync(event.getBackupId());
    }
}
