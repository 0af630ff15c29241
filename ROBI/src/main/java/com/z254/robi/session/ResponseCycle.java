package com.z254.robi.session;

import com.z254.robi.api.websocket.ErrorCode;
import com.z254.robi.api.websocket.ServerMessage;
import com.z254.robi.background.SideEffectPersister;
import com.z254.robi.background.TurnOutcome;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.conversation.ConversationHistoryService;
import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.llm.GenerativeBackend;
import com.z254.robi.llm.TurnInput;
import com.z254.robi.memory.MemoryContext;
import com.z254.robi.memory.MemoryService;
import com.z254.robi.motion.MotionCompiler;
import com.z254.robi.motion.MoveSequence;
import com.z254.robi.observability.StructuredLogger;
import com.z254.robi.people.PersonService;
import com.z254.robi.tag.CaptureIntentClassifier;
import com.z254.robi.tag.DecodedFragment;
import com.z254.robi.tag.DecodedResponse;
import com.z254.robi.tag.StreamingTagDecoder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one turn: loads context and history, streams the model reply through the tag
 * decoder and turns it into emotion, text, metadata and end-of-stream messages. Persistence
 * is handed to the background once the stream has ended.
 */
@Slf4j
@Component
public class ResponseCycle {

    static final String ACTIONS_DESCRIPTION = "Response actions";

    private final GenerativeBackend generativeBackend;
    private final MemoryService memoryService;
    private final ConversationHistoryService historyService;
    private final MotionCompiler motionCompiler;
    private final SideEffectPersister sideEffectPersister;
    private final StructuredLogger structuredLogger;
    private final RobiProperties robiProperties;
    private final Counter turnsCompletedCounter;
    private final Counter turnsFailedCounter;
    private final Timer turnLatencyTimer;

    public ResponseCycle(GenerativeBackend generativeBackend,
                         MemoryService memoryService,
                         ConversationHistoryService historyService,
                         MotionCompiler motionCompiler,
                         SideEffectPersister sideEffectPersister,
                         StructuredLogger structuredLogger,
                         RobiProperties robiProperties,
                         @Qualifier("turnsCompletedCounter") Counter turnsCompletedCounter,
                         @Qualifier("turnsFailedCounter") Counter turnsFailedCounter,
                         @Qualifier("turnLatencyTimer") Timer turnLatencyTimer) {
        this.generativeBackend = generativeBackend;
        this.memoryService = memoryService;
        this.historyService = historyService;
        this.motionCompiler = motionCompiler;
        this.sideEffectPersister = sideEffectPersister;
        this.structuredLogger = structuredLogger;
        this.robiProperties = robiProperties;
        this.turnsCompletedCounter = turnsCompletedCounter;
        this.turnsFailedCounter = turnsFailedCounter;
        this.turnLatencyTimer = turnLatencyTimer;
    }

    public Flux<ServerMessage> run(SessionContext context, String requestId, TurnInput input) {
        long startNanos = System.nanoTime();
        String sessionId = context.getSessionId();
        String personId = context.getPersonId();
        Double confidence = personId != null ? context.getConfidence() : null;
        StreamingTagDecoder decoder = new StreamingTagDecoder(robiProperties.getSession().getTagBufferCap());

        Mono<MemoryContext> memoryContext = memoryService.loadContext(personId, context.getCurrentZone())
                .defaultIfEmpty(MemoryContext.empty())
                .onErrorResume(e -> {
                    log.warn("Memory context unavailable for request {}: {}", requestId, e.getMessage());
                    return Mono.just(MemoryContext.empty());
                });
        Mono<List<ConversationMessage>> history = historyService.getHistory(sessionId)
                .collectList()
                .onErrorResume(e -> {
                    log.warn("History unavailable for session {}: {}", sessionId, e.getMessage());
                    return Mono.just(List.of());
                });

        Flux<ServerMessage> streamed = Mono.zip(memoryContext, history)
                .flatMapMany(loaded -> decoder.decode(generativeBackend
                        .streamResponse(loaded.getT2(), input, loaded.getT1().render())))
                .map(fragment -> toMessage(fragment, requestId, personId, confidence));

        return streamed
                .concatWith(Flux.defer(() -> finish(context, requestId, input, decoder.result(), startNanos)))
                .onErrorResume(e -> {
                    turnsFailedCounter.increment();
                    log.error("Turn {} failed", requestId, e);
                    structuredLogger.logTurnFailed(sessionId, requestId, ErrorCode.AGENT_ERROR.name(), e.getMessage());
                    return Flux.just(ServerMessage.error(requestId, ErrorCode.AGENT_ERROR,
                            "Failed to generate a response: " + e.getMessage()));
                });
    }

    private static ServerMessage toMessage(DecodedFragment fragment, String requestId,
                                           String personId, Double confidence) {
        if (fragment.isEmotion()) {
            return ServerMessage.emotion(requestId, fragment.emotion().getTag(), personId, confidence);
        }
        return ServerMessage.textChunk(requestId, fragment.text());
    }

    private Flux<ServerMessage> finish(SessionContext context, String requestId, TurnInput input,
                                       DecodedResponse response, long startNanos) {
        String responseText = response.getVisibleText().strip();
        String emotion = response.getEmotion().getTag();
        List<ServerMessage> messages = new ArrayList<>(3);

        CaptureIntentClassifier.classify(responseText)
                .ifPresent(captureType -> messages.add(ServerMessage.captureRequest(requestId, captureType)));

        List<MoveSequence> actions = response.getActions().isEmpty()
                ? List.of()
                : List.of(motionCompiler.buildMoveSequence(ACTIONS_DESCRIPTION, response.getActions(), emotion));

        messages.add(ServerMessage.responseMeta(requestId, responseText, response.expressionEmojis(), actions,
                response.getDirectives().personName().orElse(null)));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        messages.add(ServerMessage.streamEnd(requestId, elapsedMs));

        return Flux.fromIterable(messages)
                .doOnComplete(() -> {
                    turnsCompletedCounter.increment();
                    turnLatencyTimer.record(elapsedMs, TimeUnit.MILLISECONDS);
                    structuredLogger.logTurnCompleted(context.getSessionId(), requestId, input.kind(),
                            emotion, responseText.length(), elapsedMs);
                    schedulePersistence(context, requestId, input, response);
                });
    }

    /**
     * Adopt a newly learned name as the session identity and hand the turn to the background.
     */
    private void schedulePersistence(SessionContext context, String requestId, TurnInput input,
                                     DecodedResponse response) {
        String personId = context.getPersonId();
        List<Float> embedding = null;
        if (response.getDirectives().personName().isPresent()) {
            String name = response.getDirectives().personName().get();
            if (personId == null) {
                personId = PersonService.slugFor(name);
            }
            context.identify(personId, context.getConfidence());
            embedding = context.takePendingEmbedding();
        }
        sideEffectPersister.persistTurn(new TurnOutcome(context.getSessionId(), requestId, input, response,
                personId, context.getCurrentZone(), embedding));
    }
}
