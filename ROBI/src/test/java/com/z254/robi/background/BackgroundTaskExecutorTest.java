package com.z254.robi.background;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BackgroundTaskExecutor}.
 */
class BackgroundTaskExecutorTest {

    private MeterRegistry meterRegistry;
    private BackgroundTaskExecutor executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        executor = new BackgroundTaskExecutor(Schedulers.immediate(),
                new StructuredLogger(new ObjectMapper()), meterRegistry);
    }

    @Test
    @DisplayName("should run a submitted task")
    void runTask() {
        AtomicBoolean ran = new AtomicBoolean();

        executor.submit("history", "s1", () -> Mono.fromRunnable(() -> ran.set(true)));

        assertThat(ran).isTrue();
        assertThat(executor.getInFlightCount()).isZero();
        assertThat(meterRegistry.counter("robi.background.tasks.submitted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should count failures without propagating them")
    void swallowFailure() {
        executor.submit("memory", "s1", () -> Mono.error(new IllegalStateException("store down")));
        executor.submit("person", null, () -> {
            throw new IllegalArgumentException("bad input");
        });

        assertThat(meterRegistry.counter("robi.background.tasks.failed").count()).isEqualTo(2.0);
        assertThat(executor.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("should report tasks still running")
    void trackInFlight() {
        Sinks.Empty<Void> gate = Sinks.empty();

        executor.submit("zone_learn", "s1", gate::asMono);

        assertThat(executor.getInFlightCount()).isEqualTo(1);
        assertThat(meterRegistry.get("robi.background.tasks.inflight").gauge().value()).isEqualTo(1.0);

        gate.tryEmitEmpty();

        assertThat(executor.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("should keep failures of one task away from the next")
    void independentTasks() {
        AtomicBoolean second = new AtomicBoolean();

        executor.submit("first", "s1", () -> Mono.error(new IllegalStateException("boom")));
        executor.submit("second", "s1", () -> Mono.fromRunnable(() -> second.set(true)));

        assertThat(second).isTrue();
    }
}
