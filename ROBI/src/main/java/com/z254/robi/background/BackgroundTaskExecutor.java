package com.z254.robi.background;

import com.z254.robi.config.RobiProperties;
import com.z254.robi.observability.StructuredLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Fire-and-forget runner for work that must not delay or fail a response, such as
 * persisting history and side effects. Tasks run on a dedicated bounded scheduler and are
 * subscribed independently of any session, so closing a connection never cancels them.
 * A failing task is logged and counted, then dropped.
 */
@Slf4j
@Component
public class BackgroundTaskExecutor {

    private final Scheduler scheduler;
    private final StructuredLogger structuredLogger;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Counter submittedCounter;
    private final Counter failedCounter;

    @Autowired
    public BackgroundTaskExecutor(RobiProperties robiProperties,
                                  StructuredLogger structuredLogger,
                                  MeterRegistry meterRegistry) {
        this(Schedulers.newBoundedElastic(
                        robiProperties.getBackground().getThreadCap(),
                        robiProperties.getBackground().getQueuedTaskCap(),
                        "robi-background"),
                structuredLogger, meterRegistry);
    }

    public BackgroundTaskExecutor(Scheduler scheduler,
                                  StructuredLogger structuredLogger,
                                  MeterRegistry meterRegistry) {
        this.scheduler = scheduler;
        this.structuredLogger = structuredLogger;
        this.submittedCounter = Counter.builder("robi.background.tasks.submitted")
                .description("Background tasks scheduled")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("robi.background.tasks.failed")
                .description("Background tasks that failed and were dropped")
                .register(meterRegistry);
        Gauge.builder("robi.background.tasks.inflight", inFlight, AtomicInteger::get)
                .description("Background tasks currently running")
                .register(meterRegistry);
    }

    /**
     * Schedule a task. The supplier is invoked on the background scheduler, so exceptions
     * thrown while assembling the task are handled like any other failure.
     *
     * @param taskName  name used in logs
     * @param sessionId session that caused the task, for log correlation; may be null
     * @param task      work to run
     * @return handle that can be used to cancel the task; callers normally ignore it
     */
    public Disposable submit(String taskName, String sessionId, Supplier<? extends Mono<?>> task) {
        submittedCounter.increment();
        inFlight.incrementAndGet();
        return Mono.defer(task)
                .subscribeOn(scheduler)
                .doOnSuccess(result -> log.debug("Background task {} finished", taskName))
                .onErrorResume(e -> {
                    failedCounter.increment();
                    log.warn("Background task {} failed: {}", taskName, e.getMessage());
                    structuredLogger.logBackgroundTaskFailed(taskName, sessionId, e.getMessage());
                    return Mono.empty();
                })
                .doFinally(signal -> inFlight.decrementAndGet())
                .subscribe();
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down background executor with {} tasks in flight", inFlight.get());
        scheduler.dispose();
    }
}
