package com.labbackup.api.repository;

import com.labbackup.api.model.entity.SourceLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SourceLockRepository extends JpaRepository<SourceLock, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM SourceLock l WHERE l.lockKey = :lockKey")
    Optional<SourceLock> findByLockKeyForUpdate(@Param("lockKey") String lockKey);
}
