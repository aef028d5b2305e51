package com.labbackup.api.repository;

import com.labbackup.api.model.entity.Backup;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BackupRepository extends JpaRepository<Backup, UUID> {

    List<Backup> findBySourceTypeAndSourceIdOrderByCreatedAtDesc(String sourceType, Long sourceId);

    List<Backup> findBySourceTypeAndSourceIdAndStatusIn(String sourceType, Long sourceId, Collection<String> statuses);

    List<Backup> findByChainIdOrderBySequenceNumberAsc(UUID chainId);

    List<Backup> findBySourceTypeAndSourceIdAndStatus(String sourceType, Long sourceId, String status);

    /**
     * Completed backups of a source, newest first. Failed and cancelled rows never qualify,
     * which is what makes a failed capture invisible to chain derivation.
     */
    @Query("SELECT b FROM Backup b WHERE b.sourceType = :sourceType AND b.sourceId = :sourceId " +
           "AND b.status = 'completed' ORDER BY b.completedAt DESC, b.sequenceNumber DESC")
    List<Backup> findCompletedBySourceNewestFirst(@Param("sourceType") String sourceType,
                                                  @Param("sourceId") Long sourceId);

    @Query("SELECT b FROM Backup b WHERE b.sourceType = :sourceType AND b.sourceId = :sourceId " +
           "AND b.status = 'completed' ORDER BY b.completedAt ASC")
    List<Backup> findCompletedBySourceOldestFirst(@Param("sourceType") String sourceType,
                                                  @Param("sourceId") Long sourceId);

    @Query("SELECT DISTINCT b.chainId FROM Backup b WHERE b.sourceType = :sourceType AND b.sourceId = :sourceId")
    List<UUID> findChainIdsBySource(@Param("sourceType") String sourceType, @Param("sourceId") Long sourceId);

    @Query("SELECT DISTINCT b.chainId FROM Backup b WHERE b.status <> 'deleted'")
    List<UUID> findLiveChainIds();

    /**
     * Every source that still owns a completed or delete-pending backup, whether or not a schedule exists for it.
     */
    @Query("SELECT DISTINCT b.sourceType AS sourceType, b.sourceId AS sourceId FROM Backup b " +
           "WHERE b.status IN ('completed', 'delete_pending') ORDER BY b.sourceType, b.sourceId")
    List<SourceRef> findSourcesWithRetainedBackups();

    interface SourceRef {
        String getSourceType();

        Long getSourceId();
    }
}
