package com.labbackup.api.config;

import com.labbackup.api.service.storage.S3StorageGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("StartupValidator")
@ExtendWith(MockitoExtension.class)
class StartupValidatorTest {

    @Mock
    private S3StorageGateway storageGateway;

    @InjectMocks
    private StartupValidator validator;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(validator, "defaultMaxChainLength", 30);
        ReflectionTestUtils.setField(validator, "capabilityCheckAttempts", 3);
        ReflectionTestUtils.setField(validator, "retentionZone", "Europe/Berlin");
        ReflectionTestUtils.setField(validator, "sweepCron", "0 0 5 * * *");
        ReflectionTestUtils.setField(validator, "defaultDaily", 7);
        ReflectionTestUtils.setField(validator, "defaultWeekly", 4);
        ReflectionTestUtils.setField(validator, "defaultMonthly", 12);
        ReflectionTestUtils.setField(validator, "defaultYearly", 5);
        ReflectionTestUtils.setField(validator, "restoreThroughput", 104857600L);
    }

    @Test
    @DisplayName("should accept the default settings, even without storage")
    void shouldAcceptDefaults() {
        when(storageGateway.isConfigured()).thenReturn(false);

        assertThatCode(() -> validator.validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should reject a chain length below one")
    void shouldRejectChainLength() {
        ReflectionTestUtils.setField(validator, "defaultMaxChainLength", 0);

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("default-max-length");
    }

    @Test
    @DisplayName("should reject an unknown zone")
    void shouldRejectZone() {
        ReflectionTestUtils.setField(validator, "retentionZone", "Mars/Olympus");

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    @DisplayName("should reject an invalid sweep cron")
    void shouldRejectSweepCron() {
        ReflectionTestUtils.setField(validator, "sweepCron", "daily");

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sweep-cron");
    }

    @Test
    @DisplayName("should reject negative default retention")
    void shouldRejectRetention() {
        ReflectionTestUtils.setField(validator, "defaultWeekly", -1);

        assertThatThrownBy(() -> validator.validate())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retention");
    }
}
