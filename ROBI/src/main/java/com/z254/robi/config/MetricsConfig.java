package com.z254.robi.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the ROBI service.
 * Components that own gauges or tagged meters register them against the {@link MeterRegistry} directly.
 */
@Configuration
public class MetricsConfig {

    // ==================== Turn Metrics ====================

    @Bean
    public Counter turnsCompletedCounter(MeterRegistry registry) {
        return Counter.builder("robi.turns.completed")
                .description("Response cycles that reached stream_end")
                .register(registry);
    }

    @Bean
    public Counter turnsFailedCounter(MeterRegistry registry) {
        return Counter.builder("robi.turns.failed")
                .description("Response cycles that ended with a recoverable agent error")
                .register(registry);
    }

    @Bean
    public Timer turnLatencyTimer(MeterRegistry registry) {
        return Timer.builder("robi.turn.latency")
                .description("Time from turn start to stream_end")
                .register(registry);
    }
}
