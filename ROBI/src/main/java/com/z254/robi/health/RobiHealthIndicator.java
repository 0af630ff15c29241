package com.z254.robi.health;

import com.z254.robi.background.BackgroundTaskExecutor;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.llm.LLMProviderRegistry;
import com.z254.robi.session.CompanionSessionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for ROBI.
 * Reports open sessions, pending background work and which backend answers turns.
 * Down when no generative provider is available.
 */
@Component
@Slf4j
public class RobiHealthIndicator implements ReactiveHealthIndicator {

    private final CompanionSessionEngine sessionEngine;
    private final BackgroundTaskExecutor backgroundTaskExecutor;
    private final LLMProviderRegistry providerRegistry;
    private final RobiProperties robiProperties;

    public RobiHealthIndicator(CompanionSessionEngine sessionEngine,
                               BackgroundTaskExecutor backgroundTaskExecutor,
                               LLMProviderRegistry providerRegistry,
                               RobiProperties robiProperties) {
        this.sessionEngine = sessionEngine;
        this.backgroundTaskExecutor = backgroundTaskExecutor;
        this.providerRegistry = providerRegistry;
        this.robiProperties = robiProperties;
    }

    @Override
    public Mono<Health> health() {
        return checkProvider()
                .map(providerUp -> {
                    Health.Builder builder = providerUp ? Health.up() : Health.down();
                    builder.withDetail("llm", providerUp ? "UP" : "DOWN");
                    builder.withDetail("activeSessions", sessionEngine.getActiveSessionCount());
                    builder.withDetail("backgroundTasksInFlight", backgroundTaskExecutor.getInFlightCount());
                    builder.withDetail("storage", robiProperties.getStorage().getType());
                    builder.withDetail("defaultLLMProvider", providerRegistry.getDefaultProviderId());
                    return builder.build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }

    private Mono<Boolean> checkProvider() {
        if (!providerRegistry.getProviderIds().contains(providerRegistry.getDefaultProviderId())) {
            return Mono.just(false);
        }
        return providerRegistry.getDefaultProvider()
                .isAvailable()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false);
    }
}
