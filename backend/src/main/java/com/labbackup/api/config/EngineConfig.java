package com.labbackup.api.config;

import com.labbackup.api.engine.ChainBuilder;
import com.labbackup.api.engine.ChainIntegrityChecker;
import com.labbackup.api.engine.GfsRetentionEvaluator;
import com.labbackup.api.engine.RestorationPlanner;
import com.labbackup.api.service.snapshot.SnapshotProducer;
import com.labbackup.api.service.snapshot.UnconfiguredSnapshotProducer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

/**
 * Wires the chain engine from configuration. The engine classes themselves hold no Spring state.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public ChainBuilder chainBuilder(@Value("${backup.chain.default-max-length:30}") int defaultMaxChainLength) {
        return new ChainBuilder(defaultMaxChainLength);
    }

    @Bean
    public ChainIntegrityChecker chainIntegrityChecker() {
        return new ChainIntegrityChecker();
    }

    @Bean
    public GfsRetentionEvaluator gfsRetentionEvaluator(@Value("${backup.retention.zone:UTC}") String zone,
                                                       ChainIntegrityChecker chainIntegrityChecker) {
        return new GfsRetentionEvaluator(ZoneId.of(zone), chainIntegrityChecker);
    }

    @Bean
    public RestorationPlanner restorationPlanner(
            @Value("${backup.restore.throughput-bytes-per-second:104857600}") long throughputBytesPerSecond) {
        return new RestorationPlanner(throughputBytesPerSecond);
    }

    @Bean
    @ConditionalOnMissingBean(SnapshotProducer.class)
    public SnapshotProducer snapshotProducer() {
        log.warn("No SnapshotProducer bean registered; captures will fail until a hypervisor integration is added");
        return new UnconfiguredSnapshotProducer();
    }
}
