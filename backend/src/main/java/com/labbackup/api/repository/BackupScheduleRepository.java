package com.labbackup.api.repository;

import com.labbackup.api.model.entity.BackupSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface BackupScheduleRepository extends JpaRepository<BackupSchedule, UUID> {

    List<BackupSchedule> findByEnabledTrue();

    List<BackupSchedule> findBySourceTypeAndSourceId(String sourceType, Long sourceId);

    @Query("SELECT s FROM BackupSchedule s WHERE s.enabled = true AND s.nextRun IS NOT NULL AND s.nextRun <= :now")
    List<BackupSchedule> findDueSchedules(@Param("now") Instant now);
}
