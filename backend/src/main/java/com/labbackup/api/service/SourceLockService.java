package com.labbackup.api.service;

import com.labbackup.api.model.entity.SourceLock;
import com.labbackup.api.repository.SourceLockRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;

/**
 * Per-source mutual exclusion for chain-identity assignment, backed by a row lock on
 * {@code source_locks}.
 */
@Slf4j
@Service
public class SourceLockService {

    private final SourceLockRepository sourceLockRepository;
    private final TransactionTemplate requiresNew;

    public SourceLockService(SourceLockRepository sourceLockRepository, PlatformTransactionManager transactionManager) {
        this.sourceLockRepository = sourceLockRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Creates the lock row for a source if it does not exist yet. Runs in its own transaction so
     * a concurrent insert of the same row does not poison the caller's transaction.
     */
    public void ensureLockRow(String sourceType, Long sourceId) {
        String key = SourceLock.keyFor(sourceType, sourceId);
        if (sourceLockRepository.existsById(key)) {
            return;
        }
        try {
            requiresNew.executeWithoutResult(status -> sourceLockRepository.saveAndFlush(SourceLock.builder()
                    .lockKey(key)
                    .sourceType(sourceType)
                    .sourceId(sourceId)
                    .build()));
            log.debug("Created lock row {}", key);
        } catch (DataIntegrityViolationException e) {
            log.debug("Lock row {} was created concurrently", key);
        }
    }

    /**
     * Locks the source's row until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public SourceLock acquire(String sourceType, Long sourceId) {
        String key = SourceLock.keyFor(sourceType, sourceId);
        SourceLock lock = sourceLockRepository.findByLockKeyForUpdate(key)
                .orElseThrow(() -> new IllegalStateException("No lock row for source " + key));
        lock.setLastAcquiredAt(Instant.now());
        return lock;
    }
}
