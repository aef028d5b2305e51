package com.labbackup.api.controller;

import com.labbackup.api.engine.TestChains;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.storage.S3StorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
@DisplayName("Chain and Source Controllers")
class ChainControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private BackupRepository backupRepository;

    @MockBean private SnapshotProducer snapshotProducer;
    @MockBean private S3StorageGateway storageGateway;

    private UUID chainId;

    @BeforeEach
    void setUp() {
        chainId = UUID.randomUUID();
        Instant start = Instant.now().minus(3, ChronoUnit.HOURS);
        Backup parent = TestChains.full(chainId, start);
        parent.setId(null);
        parent = backupRepository.save(parent);
        for (int i = 1; i <= 2; i++) {
            Backup next = TestChains.incremental(parent, start.plus(i, ChronoUnit.HOURS));
            next.setId(null);
            parent = backupRepository.save(next);
        }
    }

    @Test
    @DisplayName("GET /chains/{id} should list members in sequence order")
    void shouldGetChain() throws Exception {
        mockMvc.perform(get("/api/v1/chains/" + chainId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3))
                .andExpect(jsonPath("$.backups[0].sequenceNumber").value(0))
                .andExpect(jsonPath("$.backups[2].sequenceNumber").value(2));
    }

    @Test
    @DisplayName("GET /chains/{id} should return 404 for an unknown chain")
    void shouldReturn404() throws Exception {
        mockMvc.perform(get("/api/v1/chains/" + UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /integrity should report a healthy chain")
    void shouldCheckIntegrity() throws Exception {
        mockMvc.perform(get("/api/v1/chains/" + chainId + "/integrity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restorable").value(true))
                .andExpect(jsonPath("$.restorableThroughSequence").value(2))
                .andExpect(jsonPath("$.latestSequence").value(2));
    }

    @Test
    @DisplayName("GET /statistics should summarize the chain")
    void shouldGetStatistics() throws Exception {
        mockMvc.perform(get("/api/v1/chains/" + chainId + "/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backupCount").value(3))
                .andExpect(jsonPath("$.latestSequence").value(2))
                .andExpect(jsonPath("$.totalSizeBytes").value(1200));
    }

    @Test
    @DisplayName("GET /statistics should total sizes across chains")
    void shouldGetGlobalStatistics() throws Exception {
        mockMvc.perform(get("/api/v1/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChains").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.brokenChains").value(0))
                .andExpect(jsonPath("$.orphanedBackups").value(0));
    }

    @Test
    @DisplayName("GET /sources/{type}/{id}/orphans should be empty for a healthy chain")
    void shouldListNoOrphans() throws Exception {
        mockMvc.perform(get("/api/v1/sources/vm/101/orphans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    @DisplayName("sources with retained backups include one that has no schedule")
    void shouldListUnscheduledSource() {
        assertThat(backupRepository.findSourcesWithRetainedBackups())
                .anySatisfy(source -> {
                    assertThat(source.getSourceType()).isEqualTo(TestChains.SOURCE_TYPE);
                    assertThat(source.getSourceId()).isEqualTo(TestChains.SOURCE_ID);
                });
    }

    @Test
    @DisplayName("GET /sources/{type}/{id}/chains should list chain ids")
    void shouldListChains() throws Exception {
        mockMvc.perform(get("/api/v1/sources/vm/101/chains"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasItem(chainId.toString())));
    }

    @Test
    @DisplayName("GET /sources/{type}/{id}/retention should keep the whole chain of a retained tip")
    void shouldPreviewRetention() throws Exception {
        mockMvc.perform(get("/api/v1/sources/vm/101/retention").param("daily", "1")
                        .param("weekly", "0").param("monthly", "0").param("yearly", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.retentionConfig.daily").value(1))
                .andExpect(jsonPath("$.keep", hasSize(3)))
                .andExpect(jsonPath("$.delete", hasSize(0)))
                .andExpect(jsonPath("$.loadBearing", hasSize(2)));
    }

    @Test
    @DisplayName("GET /sources/{type}/{id}/retention should reject negative tiers")
    void shouldRejectNegativeTier() throws Exception {
        mockMvc.perform(get("/api/v1/sources/vm/101/retention").param("daily", "-1"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /sources/{type}/{id}/retention/sweep should delete nothing that is still needed")
    void shouldSweep() throws Exception {
        mockMvc.perform(post("/api/v1/sources/vm/101/retention/sweep"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted", hasSize(0)))
                .andExpect(jsonPath("$.failed", hasSize(0)));
    }
}
