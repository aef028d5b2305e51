package com.labbackup.api.service;

import com.labbackup.api.engine.ChainDecision;
import com.labbackup.api.engine.ChainPolicy;
import com.labbackup.api.engine.TestChains;
import com.labbackup.api.event.BackupCreatedEvent;
import com.labbackup.api.exception.BackupInProgressException;
import com.labbackup.api.exception.SnapshotCaptureFailedException;
import com.labbackup.api.exception.StorageUnavailableException;
import com.labbackup.api.model.dto.ManualBackupRequest;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.model.entity.BackupSchedule;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.repository.BackupScheduleRepository;
import com.labbackup.api.service.snapshot.CaptureResult;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.snapshot.SnapshotSource;
import com.labbackup.api.service.storage.StorageGateway;
import com.labbackup.api.service.storage.StoredObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("BackupService")
@ExtendWith(MockitoExtension.class)
class BackupServiceTest {

    @Mock private BackupRepository backupRepository;
    @Mock private BackupScheduleRepository scheduleRepository;
    @Mock private ChainService chainService;
    @Mock private SourceLockService sourceLockService;
    @Mock private SnapshotProducer snapshotProducer;
    @Mock private StorageGateway storageGateway;
    @Mock private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private BackupService backupService;

    private static SnapshotSource vmSource() {
        return SnapshotSource.builder().sourceType(Backup.SOURCE_VM).sourceId(101L).build();
    }

    private static Backup pendingFull() {
        return Backup.builder()
                .id(UUID.randomUUID())
                .sourceType(Backup.SOURCE_VM)
                .sourceId(101L)
                .chainId(UUID.randomUUID())
                .sequenceNumber(0)
                .backupMode(Backup.MODE_FULL)
                .storageBackendId(1L)
                .status(Backup.STATUS_PENDING)
                .build();
    }

    private static CaptureResult capture() {
        return CaptureResult.builder()
                .artifact(() -> new ByteArrayInputStream(new byte[]{1, 2, 3}))
                .sizeBytes(3L)
                .newCheckpointToken("cp-new")
                .build();
    }

    @Nested
    @DisplayName("createBackup")
    class CreateBackup {

        @Test
        @DisplayName("should lock the source, persist the decided chain identity and publish an event")
        void shouldCreatePendingBackup() {
            UUID chainId = UUID.randomUUID();
            UUID parentId = UUID.randomUUID();
            ChainDecision decision = ChainDecision.builder()
                    .backupMode(Backup.MODE_INCREMENTAL)
                    .chainId(chainId)
                    .sequenceNumber(3)
                    .parentBackupId(parentId)
                    .reason(ChainDecision.REASON_CHAIN_CONTINUED)
                    .build();
            when(backupRepository.findBySourceTypeAndSourceIdAndStatusIn(eq(Backup.SOURCE_VM), eq(101L), anyCollection()))
                    .thenReturn(List.of());
            when(chainService.decide(any(ChainPolicy.class), any(SnapshotSource.class))).thenReturn(decision);
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> {
                Backup b = inv.getArgument(0);
                b.setId(UUID.randomUUID());
                return b;
            });

            Backup result = backupService.createBackup(ChainPolicy.builder().build(), vmSource(), 1L);

            assertThat(result.getStatus()).isEqualTo(Backup.STATUS_PENDING);
            assertThat(result.getChainId()).isEqualTo(chainId);
            assertThat(result.getSequenceNumber()).isEqualTo(3);
            assertThat(result.getParentBackupId()).isEqualTo(parentId);
            assertThat(result.getModeReason()).isEqualTo(ChainDecision.REASON_CHAIN_CONTINUED);

            var inOrder = inOrder(sourceLockService, chainService, backupRepository);
            inOrder.verify(sourceLockService).ensureLockRow(Backup.SOURCE_VM, 101L);
            inOrder.verify(sourceLockService).acquire(Backup.SOURCE_VM, 101L);
            inOrder.verify(chainService).decide(any(), any());
            inOrder.verify(backupRepository).save(any(Backup.class));
            verify(eventPublisher).publishEvent(any(BackupCreatedEvent.class));
        }

        @Test
        @DisplayName("should reject a trigger while the source has a backup in flight")
        void shouldRejectConcurrentTrigger() {
            Backup running = pendingFull();
            running.setStatus(Backup.STATUS_RUNNING);
            when(backupRepository.findBySourceTypeAndSourceIdAndStatusIn(eq(Backup.SOURCE_VM), eq(101L), anyCollection()))
                    .thenReturn(List.of(running));

            assertThatThrownBy(() -> backupService.createBackup(ChainPolicy.builder().build(), vmSource(), 1L))
                    .isInstanceOf(BackupInProgressException.class)
                    .hasMessageContaining(running.getId().toString());

            verify(chainService, never()).decide(any(), any());
            verify(backupRepository, never()).save(any());
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("should reject an unknown source type")
        void shouldRejectUnknownSourceType() {
            SnapshotSource source = SnapshotSource.builder().sourceType("lxc").sourceId(1L).build();

            assertThatThrownBy(() -> backupService.createBackup(ChainPolicy.builder().build(), source, 1L))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("lxc");
        }

        @Test
        @DisplayName("should map a manual full request to a forced full policy")
        void shouldForceFullForManualFull() {
            when(backupRepository.findBySourceTypeAndSourceIdAndStatusIn(any(), any(), anyCollection()))
                    .thenReturn(List.of());
            when(chainService.decide(any(ChainPolicy.class), any(SnapshotSource.class))).thenReturn(ChainDecision.builder()
                    .backupMode(Backup.MODE_FULL).chainId(UUID.randomUUID()).sequenceNumber(0)
                    .reason(ChainDecision.REASON_REQUESTED_FULL).build());
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));

            backupService.createManualBackup(ManualBackupRequest.builder()
                    .sourceType(Backup.SOURCE_CONTAINER).sourceId(7L).storageBackendId(2L).backupMode("full").build());

            ArgumentCaptor<ChainPolicy> policy = ArgumentCaptor.forClass(ChainPolicy.class);
            verify(chainService).decide(policy.capture(), any());
            assertThat(policy.getValue().isForceFull()).isTrue();
        }

        @Test
        @DisplayName("should map a manual incremental request to incremental_preferred without forcing a full")
        void shouldPreferIncrementalForManualIncremental() {
            when(backupRepository.findBySourceTypeAndSourceIdAndStatusIn(any(), any(), anyCollection()))
                    .thenReturn(List.of());
            when(chainService.decide(any(ChainPolicy.class), any(SnapshotSource.class))).thenReturn(ChainDecision.builder()
                    .backupMode(Backup.MODE_FULL).chainId(UUID.randomUUID()).sequenceNumber(0)
                    .reason(ChainDecision.REASON_FIRST_BACKUP).build());
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));

            backupService.createManualBackup(ManualBackupRequest.builder()
                    .sourceType(Backup.SOURCE_VM).sourceId(7L).storageBackendId(2L).backupMode("incremental").build());

            ArgumentCaptor<ChainPolicy> policy = ArgumentCaptor.forClass(ChainPolicy.class);
            verify(chainService).decide(policy.capture(), any());
            assertThat(policy.getValue().isIncrementalPreferred()).isTrue();
            assertThat(policy.getValue().isForceFull()).isFalse();
        }

        @Test
        @DisplayName("should reject an unknown manual backup mode")
        void shouldRejectUnknownManualMode() {
            ManualBackupRequest request = ManualBackupRequest.builder()
                    .sourceType(Backup.SOURCE_VM).sourceId(1L).storageBackendId(1L).backupMode("differential").build();

            assertThatThrownBy(() -> backupService.createManualBackup(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("differential");
        }
    }

    @Nested
    @DisplayName("executeBackup")
    class ExecuteBackup {

        @Test
        @DisplayName("should capture, upload and complete with the stored checksum and new checkpoint")
        void shouldCompleteBackup() {
            Backup backup = pendingFull();
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(snapshotProducer.capture(any(), eq(Backup.MODE_FULL), isNull())).thenReturn(capture());
            when(storageGateway.put(eq(1L), anyString(), any(), eq(3L), anyMap()))
                    .thenReturn(StoredObject.builder().checksum("sha-stored").sizeBytes(3L).build());

            backupService.executeBackup(backup.getId());

            assertThat(backup.getStatus()).isEqualTo(Backup.STATUS_COMPLETED);
            assertThat(backup.getChecksum()).isEqualTo("sha-stored");
            assertThat(backup.getCheckpointToken()).isEqualTo("cp-new");
            assertThat(backup.getCompletedAt()).isNotNull();
            assertThat(backup.getStoragePath()).isEqualTo(BackupService.storagePath(backup));
        }

        @Test
        @DisplayName("should pass the parent's checkpoint to an incremental capture")
        void shouldUseParentCheckpoint() {
            Backup parent = TestChains.full(UUID.randomUUID(), Instant.now());
            Backup backup = pendingFull();
            backup.setBackupMode(Backup.MODE_INCREMENTAL);
            backup.setChainId(parent.getChainId());
            backup.setSequenceNumber(1);
            backup.setParentBackupId(parent.getId());
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.findById(parent.getId())).thenReturn(Optional.of(parent));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(snapshotProducer.capture(any(), eq(Backup.MODE_INCREMENTAL), eq(parent.getCheckpointToken())))
                    .thenReturn(capture());
            when(storageGateway.put(any(), anyString(), any(), anyLong(), anyMap()))
                    .thenReturn(StoredObject.builder().checksum("x").sizeBytes(3L).build());

            backupService.executeBackup(backup.getId());

            assertThat(backup.getStatus()).isEqualTo(Backup.STATUS_COMPLETED);
        }

        @Test
        @DisplayName("should mark the backup failed when capture fails")
        void shouldFailOnCaptureError() {
            Backup backup = pendingFull();
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(snapshotProducer.capture(any(), any(), any()))
                    .thenThrow(new SnapshotCaptureFailedException("disk busy"));

            backupService.executeBackup(backup.getId());

            assertThat(backup.getStatus()).isEqualTo(Backup.STATUS_FAILED);
            assertThat(backup.getErrorMessage()).contains("disk busy");
            verifyNoInteractions(storageGateway);
        }

        @Test
        @DisplayName("should mark the backup failed when storage stays unavailable")
        void shouldFailOnUploadError() {
            Backup backup = pendingFull();
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(snapshotProducer.capture(any(), any(), any())).thenReturn(capture());
            when(storageGateway.put(any(), anyString(), any(), anyLong(), anyMap()))
                    .thenThrow(new StorageUnavailableException(1L, "backend down", null));

            backupService.executeBackup(backup.getId());

            assertThat(backup.getStatus()).isEqualTo(Backup.STATUS_FAILED);
            assertThat(backup.getChainId()).isNotNull();
            assertThat(backup.getCompletedAt()).isNull();
        }

        @Test
        @DisplayName("should discard the artifact when the backup is cancelled during upload")
        void shouldDiscardArtifactWhenCancelledDuringUpload() {
            Backup backup = pendingFull();
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(snapshotProducer.capture(any(), any(), any())).thenReturn(capture());
            when(storageGateway.put(any(), anyString(), any(), anyLong(), anyMap())).thenAnswer(inv -> {
                backup.setStatus(Backup.STATUS_CANCELLED);
                return StoredObject.builder().checksum("x").sizeBytes(3L).build();
            });

            backupService.executeBackup(backup.getId());

            assertThat(backup.getStatus()).isEqualTo(Backup.STATUS_CANCELLED);
            assertThat(backup.getCompletedAt()).isNull();
            verify(storageGateway).delete(1L, BackupService.storagePath(backup));
        }

        @Test
        @DisplayName("should skip a backup that is no longer pending")
        void shouldSkipNonPending() {
            Backup backup = pendingFull();
            backup.setStatus(Backup.STATUS_CANCELLED);
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));

            backupService.executeBackup(backup.getId());

            verifyNoInteractions(snapshotProducer, storageGateway);
        }

        @Test
        @DisplayName("should carry the new checkpoint forward to the schedule")
        void shouldRecordScheduleState() {
            BackupSchedule schedule = BackupSchedule.builder().id(UUID.randomUUID()).build();
            Backup backup = pendingFull();
            backup.setScheduleId(schedule.getId());
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            when(scheduleRepository.findById(schedule.getId())).thenReturn(Optional.of(schedule));
            when(snapshotProducer.capture(any(), any(), any())).thenReturn(capture());
            when(storageGateway.put(any(), anyString(), any(), anyLong(), anyMap()))
                    .thenReturn(StoredObject.builder().checksum("x").sizeBytes(3L).build());

            backupService.executeBackup(backup.getId());

            assertThat(schedule.getCheckpointName()).isEqualTo("cp-new");
            assertThat(schedule.getLastFullBackupId()).isEqualTo(backup.getId());
            verify(scheduleRepository).save(schedule);
        }
    }

    @Nested
    @DisplayName("cancelBackup")
    class CancelBackup {

        @Test
        @DisplayName("should cancel a pending backup")
        void shouldCancelPending() {
            Backup backup = pendingFull();
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));

            Backup result = backupService.cancelBackup(backup.getId());

            assertThat(result.getStatus()).isEqualTo(Backup.STATUS_CANCELLED);
        }

        @Test
        @DisplayName("should refuse to cancel a completed backup")
        void shouldRefuseCompleted() {
            Backup backup = TestChains.full(UUID.randomUUID(), Instant.now());
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));

            assertThatThrownBy(() -> backupService.cancelBackup(backup.getId()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("completed");
        }
    }

    @Test
    @DisplayName("storage paths are grouped by source and chain")
    void shouldBuildStoragePath() {
        Backup backup = pendingFull();
        backup.setSequenceNumber(12);

        assertThat(BackupService.storagePath(backup))
                .isEqualTo("vm/101/" + backup.getChainId() + "/000012-" + backup.getId() + ".img");
    }
}
