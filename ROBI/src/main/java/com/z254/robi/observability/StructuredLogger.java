package com.z254.robi.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.context.ContextRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.util.context.Context;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Structured logging utility for ROBI.
 * Emits one JSON line per event, enriched with the session and request in scope.
 * <p>
 * The MDC keys are registered with the context-propagation registry, so values written to a
 * Reactor {@link Context} with {@link #sessionContext} are restored into the MDC on whatever
 * thread runs the pipeline.
 */
@Component
@Slf4j
public class StructuredLogger {

    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_REQUEST_ID = "requestId";

    static {
        registerMdcKey(MDC_SESSION_ID);
        registerMdcKey(MDC_REQUEST_ID);
    }

    private final ObjectMapper objectMapper;

    public StructuredLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void setSessionContext(String sessionId, String requestId) {
        if (sessionId != null) MDC.put(MDC_SESSION_ID, sessionId);
        if (requestId != null) MDC.put(MDC_REQUEST_ID, requestId);
    }

    public void clearContext() {
        MDC.remove(MDC_SESSION_ID);
        MDC.remove(MDC_REQUEST_ID);
    }

    /**
     * Reactor context carrying the session and request of a pipeline, for use with
     * {@code contextWrite}.
     */
    public Function<Context, Context> sessionContext(String sessionId, String requestId) {
        return context -> {
            Context enriched = context;
            if (sessionId != null) enriched = enriched.put(MDC_SESSION_ID, sessionId);
            if (requestId != null) enriched = enriched.put(MDC_REQUEST_ID, requestId);
            return enriched;
        };
    }

    public void logSessionOpened(String sessionId, String remoteAddress) {
        logEvent("session_opened", sessionId, null, Map.of(
                "remoteAddress", remoteAddress != null ? remoteAddress : "unknown"));
    }

    /**
     * Log session teardown, whatever ended it.
     */
    public void logSessionClosed(String sessionId, String phase, String signal, long durationMs) {
        logEvent("session_closed", sessionId, null, Map.of(
                "phase", phase,
                "signal", signal,
                "durationMs", durationMs));
    }

    public void logTurnCompleted(String sessionId, String requestId, String inputKind,
                                 String emotion, int textLength, long durationMs) {
        logEvent("turn_completed", sessionId, requestId, Map.of(
                "inputKind", inputKind,
                "emotion", emotion,
                "textLength", textLength,
                "durationMs", durationMs));
    }

    public void logTurnFailed(String sessionId, String requestId, String errorCode, String errorMessage) {
        logEvent("turn_failed", sessionId, requestId, Map.of(
                "errorCode", errorCode,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"));
    }

    public void logCompaction(String scope, int replaced, int kept, boolean success) {
        logEvent("compaction", null, null, Map.of(
                "scope", scope,
                "replaced", replaced,
                "kept", kept,
                "success", success));
    }

    public void logBackgroundTaskFailed(String taskName, String sessionId, String errorMessage) {
        logEvent("background_task_failed", sessionId, null, Map.of(
                "task", taskName,
                "errorMessage", errorMessage != null ? errorMessage : "Unknown error"));
    }

    public void logMemoryRejected(String personId, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("reason", reason);
        if (personId != null) data.put("personId", personId);
        logEvent("memory_rejected", null, null, data);
    }

    private static void registerMdcKey(String key) {
        ContextRegistry.getInstance().<String>registerThreadLocalAccessor(key,
                () -> MDC.get(key),
                value -> MDC.put(key, value),
                () -> MDC.remove(key));
    }

    private void logEvent(String eventType, String sessionId, String requestId, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "robi");

        String session = sessionId != null ? sessionId : MDC.get(MDC_SESSION_ID);
        if (session != null) event.put("sessionId", session);

        String request = requestId != null ? requestId : MDC.get(MDC_REQUEST_ID);
        if (request != null) event.put("requestId", request);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
