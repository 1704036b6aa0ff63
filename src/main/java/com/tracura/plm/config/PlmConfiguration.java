package com.tracura.plm.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(PlmProperties.class)
public class PlmConfiguration {

    /**
     * Source of "today" and "now" for every state-machine evaluation.
     * Tests replace it with a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Pool for the per-phase aggregation fan-out.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService reconciliationExecutor(PlmProperties properties) {
        return Executors.newFixedThreadPool(properties.reconciliation().parallelism());
    }
}
