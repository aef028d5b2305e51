package com.labbackup.api.service;

import com.labbackup.api.engine.TestChains;
import com.labbackup.api.model.entity.Backup;
import com.labbackup.api.repository.BackupRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ProtectionService")
@ExtendWith(MockitoExtension.class)
class ProtectionServiceTest {

    @Mock
    private BackupRepository backupRepository;

    @InjectMocks
    private ProtectionService protectionService;

    private Backup givenCompletedBackup() {
        Backup backup = TestChains.full(UUID.randomUUID(), Instant.now().minus(1, ChronoUnit.DAYS));
        when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));
        return backup;
    }

    @Nested
    @DisplayName("makeImmutable")
    class MakeImmutable {

        @Test
        @DisplayName("should set the flag and retention date")
        void shouldMakeImmutable() {
            Backup backup = givenCompletedBackup();
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));
            Instant until = Instant.now().plus(90, ChronoUnit.DAYS);

            Backup result = protectionService.makeImmutable(backup.getId(), until);

            assertThat(result.isImmutable()).isTrue();
            assertThat(result.getRetentionUntil()).isEqualTo(until);
        }

        @Test
        @DisplayName("should only extend retention, never shorten it")
        void shouldRefuseShortening() {
            Backup backup = givenCompletedBackup();
            Instant current = Instant.now().plus(90, ChronoUnit.DAYS);
            backup.setImmutable(true);
            backup.setRetentionUntil(current);

            assertThatThrownBy(() -> protectionService.makeImmutable(backup.getId(), Instant.now().plus(10, ChronoUnit.DAYS)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("extended");
            assertThat(backup.getRetentionUntil()).isEqualTo(current);
            verify(backupRepository, never()).save(any());
        }

        @Test
        @DisplayName("should reject a retention date in the past")
        void shouldRejectPastDate() {
            assertThatThrownBy(() -> protectionService.makeImmutable(UUID.randomUUID(), Instant.now().minusSeconds(60)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("future");
            verifyNoInteractions(backupRepository);
        }

        @Test
        @DisplayName("should reject a backup that is not completed")
        void shouldRejectIncomplete() {
            Backup backup = TestChains.withStatus(
                    TestChains.full(UUID.randomUUID(), Instant.now()), Backup.STATUS_RUNNING);
            when(backupRepository.findById(backup.getId())).thenReturn(Optional.of(backup));

            assertThatThrownBy(() -> protectionService.makeImmutable(backup.getId(), Instant.now().plus(1, ChronoUnit.DAYS)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("running");
        }
    }

    @Nested
    @DisplayName("enableLegalHold")
    class EnableLegalHold {

        @Test
        @DisplayName("should place the hold with its reason")
        void shouldEnableHold() {
            Backup backup = givenCompletedBackup();
            when(backupRepository.save(any(Backup.class))).thenAnswer(inv -> inv.getArgument(0));

            Backup result = protectionService.enableLegalHold(backup.getId(), "case 2024-118");

            assertThat(result.isLegalHoldEnabled()).isTrue();
            assertThat(result.getLegalHoldReason()).isEqualTo("case 2024-118");
        }

        @Test
        @DisplayName("should leave an existing hold untouched")
        void shouldKeepExistingHold() {
            Backup backup = givenCompletedBackup();
            backup.setLegalHoldEnabled(true);
            backup.setLegalHoldReason("original");

            Backup result = protectionService.enableLegalHold(backup.getId(), "another");

            assertThat(result.getLegalHoldReason()).isEqualTo("original");
            verify(backupRepository, never()).save(any());
        }

        @Test
        @DisplayName("should require a reason")
        void shouldRequireReason() {
            assertThatThrownBy(() -> protectionService.enableLegalHold(UUID.randomUUID(), " "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
