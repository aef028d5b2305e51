package com.labbackup.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.labbackup.api.engine.TestChains;
import com.labbackup.api.model.dto.ImmutabilityRequest;
import com.labbackup.api.model.dto.LegalHoldRequest;
import com.labbackup.api.model.dto.ManualBackupRequest;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.storage.S3StorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@DisplayName("Backup Controller")
class BackupControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;
    @Autowired private BackupRepository backupRepository;

    @MockBean private SnapshotProducer snapshotProducer;
    @MockBean private S3StorageGateway storageGateway;

    private Backup full;
    private Backup incremental;

    @BeforeEach
    void setUp() {
        Instant start = Instant.now().minus(2, ChronoUnit.HOURS);
        full = TestChains.full(UUID.randomUUID(), start);
        full.setId(null);
        full = backupRepository.save(full);

        incremental = TestChains.incremental(full, start.plus(1, ChronoUnit.HOURS));
        incremental.setId(null);
        incremental = backupRepository.save(incremental);
    }

    @Nested
    @DisplayName("GET /api/v1/backups")
    class ListBackups {

        @Test
        @DisplayName("should list backups of a source with totals")
        void shouldListBackups() throws Exception {
            mockMvc.perform(get("/api/v1/backups")
                            .param("sourceType", "vm")
                            .param("sourceId", "101"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.count").value(2))
                    .andExpect(jsonPath("$.completedCount").value(2))
                    .andExpect(jsonPath("$.backups", hasSize(2)));
        }

        @Test
        @DisplayName("should require the source parameters")
        void shouldRequireSource() throws Exception {
            mockMvc.perform(get("/api/v1/backups").param("sourceType", "vm"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("should reject an unknown source type")
        void shouldRejectSourceType() throws Exception {
            mockMvc.perform(get("/api/v1/backups")
                            .param("sourceType", "lxc")
                            .param("sourceId", "101"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message", containsString("lxc")));
        }
    }

    @Nested
    @DisplayName("POST /api/v1/backups")
    class CreateBackup {

        @Test
        @DisplayName("should create a pending full backup for a new source")
        void shouldCreateBackup() throws Exception {
            ManualBackupRequest request = ManualBackupRequest.builder()
                    .sourceType("container").sourceId(220L).storageBackendId(1L).build();

            mockMvc.perform(post("/api/v1/backups")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("pending"))
                    .andExpect(jsonPath("$.backupMode").value("full"))
                    .andExpect(jsonPath("$.sequenceNumber").value(0))
                    .andExpect(jsonPath("$.modeReason").value("first_backup"));
        }

        @Test
        @DisplayName("should continue the chain when incremental capture is available")
        void shouldContinueChain() throws Exception {
            when(snapshotProducer.checkIncrementalCapability(any())).thenReturn(true);
            ManualBackupRequest request = ManualBackupRequest.builder()
                    .sourceType("vm").sourceId(101L).storageBackendId(1L).build();

            mockMvc.perform(post("/api/v1/backups")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(request)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.backupMode").value("incremental"))
                    .andExpect(jsonPath("$.chainId").value(full.getChainId().toString()))
                    .andExpect(jsonPath("$.sequenceNumber").value(2))
                    .andExpect(jsonPath("$.parentBackupId").value(incremental.getId().toString()));
        }

        @Test
        @DisplayName("should reject a second trigger while one is in flight")
        void shouldRejectConcurrentTrigger() throws Exception {
            String body = objectMapper.writeValueAsString(ManualBackupRequest.builder()
                    .sourceType("vm").sourceId(101L).storageBackendId(1L).backupMode("full").build());

            mockMvc.perform(post("/api/v1/backups").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isCreated());
            mockMvc.perform(post("/api/v1/backups").contentType(MediaType.APPLICATION_JSON).content(body))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("backup_in_progress"))
                    .andExpect(jsonPath("$.activeBackupId").isNotEmpty());
        }

        @Test
        @DisplayName("should validate the request body")
        void shouldValidateRequest() throws Exception {
            mockMvc.perform(post("/api/v1/backups")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"sourceType\":\"lxc\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.errors.sourceType").exists())
                    .andExpect(jsonPath("$.errors.sourceId").exists());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/backups/{id}")
    class GetBackup {

        @Test
        @DisplayName("should return the backup")
        void shouldGetBackup() throws Exception {
            mockMvc.perform(get("/api/v1/backups/" + incremental.getId()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.parentBackupId").value(full.getId().toString()));
        }

        @Test
        @DisplayName("should return 404 for an unknown backup")
        void shouldReturn404() throws Exception {
            mockMvc.perform(get("/api/v1/backups/" + UUID.randomUUID()))
                    .andExpect(status().isNotFound());
        }
    }

    @Nested
    @DisplayName("GET /api/v1/backups/{id}/restore-plan")
    class RestorePlan {

        @Test
        @DisplayName("should list the full and each incremental in apply order")
        void shouldPlanRestore() throws Exception {
            mockMvc.perform(get("/api/v1/backups/" + incremental.getId() + "/restore-plan"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.steps", hasSize(2)))
                    .andExpect(jsonPath("$.steps[0].action").value("restore_full"))
                    .andExpect(jsonPath("$.steps[1].action").value("apply_incremental"))
                    .andExpect(jsonPath("$.totalSizeBytes").value(1100));
        }

        @Test
        @DisplayName("should report a broken chain as a conflict")
        void shouldReportBrokenChain() throws Exception {
            full.setStatus(Backup.STATUS_DELETED);
            backupRepository.save(full);

            mockMvc.perform(get("/api/v1/backups/" + incremental.getId() + "/restore-plan"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("chain_broken"))
                    .andExpect(jsonPath("$.lastRestorableSequence").value(-1));
        }
    }

    @Nested
    @DisplayName("DELETE /api/v1/backups/{id}")
    class DeleteBackup {

        @Test
        @DisplayName("should describe the cascade before deleting")
        void shouldDescribeCascade() throws Exception {
            mockMvc.perform(get("/api/v1/backups/" + full.getId() + "/deletion-info"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.totalCount").value(2))
                    .andExpect(jsonPath("$.requiresConfirmation").value(true))
                    .andExpect(jsonPath("$.dependentBackups[0].id").value(incremental.getId().toString()));
        }

        @Test
        @DisplayName("should require confirmation for a backup with dependents")
        void shouldRequireConfirmation() throws Exception {
            mockMvc.perform(delete("/api/v1/backups/" + full.getId()))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.message", containsString("dependent")));
        }

        @Test
        @DisplayName("should delete the chain when confirmed")
        void shouldDeleteConfirmed() throws Exception {
            when(storageGateway.delete(anyLong(), anyString())).thenReturn(true);

            mockMvc.perform(delete("/api/v1/backups/" + full.getId()).param("confirm", "true"))
                    .andExpect(status().isOk());

            assertThat(backupRepository.findById(full.getId()).orElseThrow().getStatus())
                    .isEqualTo(Backup.STATUS_DELETED);
            assertThat(backupRepository.findById(incremental.getId()).orElseThrow().getStatus())
                    .isEqualTo(Backup.STATUS_DELETED);
        }

        @Test
        @DisplayName("should refuse to delete a backup under legal hold")
        void shouldRefuseLegalHold() throws Exception {
            mockMvc.perform(post("/api/v1/backups/" + incremental.getId() + "/legal-hold")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(objectMapper.writeValueAsString(new LegalHoldRequest("audit 42"))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.legalHoldEnabled").value(true));

            mockMvc.perform(delete("/api/v1/backups/" + incremental.getId()))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.message", containsString("legal_hold")));
        }
    }

    @Test
    @DisplayName("POST /immutable should protect a completed backup")
    void shouldMakeImmutable() throws Exception {
        Instant until = Instant.now().plus(30, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);

        mockMvc.perform(post("/api/v1/backups/" + full.getId() + "/immutable")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new ImmutabilityRequest(until))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.immutable").value(true));
    }

    @Test
    @DisplayName("POST /cancel should refuse a completed backup")
    void shouldRefuseCancelCompleted() throws Exception {
        mockMvc.perform(post("/api/v1/backups/" + full.getId() + "/cancel"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("POST /verify should accept a completed backup")
    void shouldAcceptVerification() throws Exception {
        mockMvc.perform(post("/api/v1/backups/" + full.getId() + "/verify"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.message").value("Verification started"));
    }
}
