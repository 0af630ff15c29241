package com.z254.robi.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.api.websocket.ClientMessage;
import com.z254.robi.api.websocket.ErrorCode;
import com.z254.robi.api.websocket.ServerMessage;
import com.z254.robi.background.SideEffectPersister;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.ZoneCategory;
import com.z254.robi.llm.MediaPart;
import com.z254.robi.llm.TurnInput;
import com.z254.robi.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Protocol engine for one device connection, independent of the transport.
 * <p>
 * The first frame must authenticate within the configured timeout; anything else ends the
 * session with a {@link ProtocolViolationException}. After that, frames are handled strictly
 * one at a time, each running to completion (including its response cycle) before the next
 * is read.
 */
@Slf4j
@Component
public class CompanionSessionEngine {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ApiKeyAuthenticator authenticator;
    private final ResponseCycle responseCycle;
    private final ExplorationService explorationService;
    private final SideEffectPersister sideEffectPersister;
    private final StructuredLogger structuredLogger;
    private final ObjectMapper objectMapper;
    private final RobiProperties robiProperties;
    private final Clock clock;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public CompanionSessionEngine(ApiKeyAuthenticator authenticator,
                                  ResponseCycle responseCycle,
                                  ExplorationService explorationService,
                                  SideEffectPersister sideEffectPersister,
                                  StructuredLogger structuredLogger,
                                  ObjectMapper objectMapper,
                                  RobiProperties robiProperties,
                                  Clock clock) {
        this.authenticator = authenticator;
        this.responseCycle = responseCycle;
        this.explorationService = explorationService;
        this.sideEffectPersister = sideEffectPersister;
        this.structuredLogger = structuredLogger;
        this.objectMapper = objectMapper;
        this.robiProperties = robiProperties;
        this.clock = clock;
    }

    /**
     * Run a session over the given inbound frames.
     *
     * @param inbound       frames as received from the device
     * @param remoteAddress peer address for logs
     * @return messages to send, in order; terminates with a {@link ProtocolViolationException}
     *         when the connection must be closed for a handshake violation
     */
    public Flux<ServerMessage> run(Flux<InboundFrame> inbound, String remoteAddress) {
        SessionContext context = new SessionContext();
        long[] openedAt = new long[1];

        return inbound
                .timeout(Mono.delay(robiProperties.getSession().getAuthTimeout()), frame -> Mono.never())
                .onErrorMap(TimeoutException.class,
                        e -> new ProtocolViolationException("No authentication received in time"))
                .switchOnFirst((first, frames) -> {
                    if (!first.hasValue()) {
                        return first.isOnError() ? Flux.error(first.getThrowable()) : Flux.empty();
                    }
                    ServerMessage authOk;
                    try {
                        authOk = authenticate(context, first.get());
                    } catch (ProtocolViolationException e) {
                        return Flux.error(e);
                    }
                    return Flux.concat(
                            Mono.just(authOk),
                            frames.skip(1).concatMap(frame -> dispatch(context, frame)));
                })
                .onErrorResume(e -> !(e instanceof ProtocolViolationException), e -> {
                    log.error("Session {} failed", context.getSessionId(), e);
                    structuredLogger.logTurnFailed(context.getSessionId(), context.getLastRequestId(),
                            ErrorCode.INTERNAL_ERROR.name(), e.getMessage());
                    return Flux.just(ServerMessage.error(context.getLastRequestId(), ErrorCode.INTERNAL_ERROR,
                            "Internal error: " + e.getMessage()));
                })
                .doOnError(ProtocolViolationException.class,
                        e -> log.warn("Closing connection from {}: {}", remoteAddress, e.getMessage()))
                .doOnSubscribe(subscription -> {
                    openedAt[0] = System.nanoTime();
                    context.setPhase(SessionPhase.AUTHENTICATING);
                    activeSessions.incrementAndGet();
                    structuredLogger.logSessionOpened(null, remoteAddress);
                })
                .doFinally(signal -> {
                    SessionPhase lastPhase = context.getPhase();
                    context.setPhase(SessionPhase.CLOSED);
                    activeSessions.decrementAndGet();
                    sideEffectPersister.sessionClosed(context.getSessionId());
                    structuredLogger.logSessionClosed(context.getSessionId(), lastPhase.name(), signal.name(),
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - openedAt[0]));
                });
    }

    public int getActiveSessionCount() {
        return activeSessions.get();
    }

    private ServerMessage authenticate(SessionContext context, InboundFrame frame) {
        if (frame.isBinary()) {
            throw new ProtocolViolationException("Expected auth message, got binary frame");
        }
        ClientMessage message = parse(frame.text());
        if (message == null || !ClientMessage.AUTH.equals(message.getType())) {
            throw new ProtocolViolationException("First message must be auth");
        }
        if (!authenticator.isValid(message.getApiKey())) {
            throw new ProtocolViolationException("Invalid API key");
        }
        String sessionId = UUID.randomUUID().toString();
        context.activate(sessionId);
        log.info("Session {} authenticated (device {})", sessionId, message.getDeviceId());
        return ServerMessage.authOk(sessionId);
    }

    private Flux<ServerMessage> dispatch(SessionContext context, InboundFrame frame) {
        if (frame.isBinary()) {
            context.appendAudio(frame.data());
            return Flux.empty();
        }
        ClientMessage message = parse(frame.text());
        if (message == null || message.getType() == null) {
            return Flux.just(ServerMessage.error(context.getLastRequestId(), ErrorCode.INVALID_MESSAGE,
                    "Message is not a valid JSON object with a type"));
        }

        String requestId = context.resolveRequestId(message.getRequestId());
        String sessionId = context.getSessionId();
        return Flux.defer(() -> handle(context, requestId, message))
                .doFirst(() -> structuredLogger.setSessionContext(sessionId, requestId))
                .doFinally(signal -> structuredLogger.clearContext())
                .contextWrite(structuredLogger.sessionContext(sessionId, requestId));
    }

    private Flux<ServerMessage> handle(SessionContext context, String requestId, ClientMessage message) {
        return switch (message.getType()) {
            case ClientMessage.INTERACTION_START -> handleInteractionStart(context, message);
            case ClientMessage.TEXT -> handleText(context, requestId, message);
            case ClientMessage.AUDIO_END -> handleAudioEnd(context, requestId, message);
            case ClientMessage.IMAGE -> handleVisual(context, requestId, message, MediaPart.Kind.IMAGE);
            case ClientMessage.VIDEO -> handleVisual(context, requestId, message, MediaPart.Kind.VIDEO);
            case ClientMessage.MULTIMODAL -> handleMultimodal(context, requestId, message);
            case ClientMessage.EXPLORE_MODE -> explorationService.explore(requestId, message.getDurationMinutes()).flux();
            case ClientMessage.FACE_SCAN_MODE -> explorationService.faceScan(requestId).flux();
            case ClientMessage.ZONE_UPDATE -> handleZoneUpdate(context, requestId, message);
            case ClientMessage.PERSON_DETECTED -> handlePersonDetected(context, message);
            case ClientMessage.PING -> Flux.just(ServerMessage.pong(clock.instant()));
            case ClientMessage.AUTH -> Flux.just(ServerMessage.error(requestId, ErrorCode.ALREADY_AUTHENTICATED,
                    "Session is already authenticated"));
            default -> Flux.just(ServerMessage.error(requestId, ErrorCode.UNKNOWN_MESSAGE_TYPE,
                    "Unknown message type: " + message.getType()));
        };
    }

    private Flux<ServerMessage> handleInteractionStart(SessionContext context, ClientMessage message) {
        context.startInteraction(message.getPersonId(), message.getFaceEmbedding());
        log.debug("Interaction started in session {} for {}", context.getSessionId(),
                context.isIdentified() ? context.getPersonId() : "anonymous");
        return Flux.empty();
    }

    private Flux<ServerMessage> handleText(SessionContext context, String requestId, ClientMessage message) {
        if (message.getContent() == null || message.getContent().isBlank()) {
            return Flux.just(ServerMessage.error(requestId, ErrorCode.EMPTY_TEXT, "Text message has no content"));
        }
        return responseCycle.run(context, requestId, TurnInput.text(message.getContent()));
    }

    private Flux<ServerMessage> handleAudioEnd(SessionContext context, String requestId, ClientMessage message) {
        byte[] audio = context.drainAudio();
        if (audio.length == 0) {
            return Flux.just(ServerMessage.error(requestId, ErrorCode.EMPTY_AUDIO, "No audio received before audio_end"));
        }
        return responseCycle.run(context, requestId,
                new TurnInput(null, List.of(MediaPart.audio(audio, message.getMime()))));
    }

    private Flux<ServerMessage> handleVisual(SessionContext context, String requestId, ClientMessage message,
                                             MediaPart.Kind kind) {
        byte[] data = decodeBase64(message.getData());
        if (data == null && !hasText(message.getText())) {
            return Flux.just(ServerMessage.error(requestId, ErrorCode.INVALID_MEDIA,
                    "Could not decode " + kind.name().toLowerCase(Locale.ROOT) + " data"));
        }
        List<MediaPart> media = new ArrayList<>(1);
        if (data != null) {
            media.add(kind == MediaPart.Kind.IMAGE
                    ? MediaPart.image(data, message.getMime())
                    : MediaPart.video(data, message.getMime()));
        }
        return responseCycle.run(context, requestId, new TurnInput(message.getText(), media));
    }

    private Flux<ServerMessage> handleMultimodal(SessionContext context, String requestId, ClientMessage message) {
        List<MediaPart> media = new ArrayList<>(3);
        byte[] audio = decodeBase64(message.getAudio());
        if (audio != null) {
            media.add(MediaPart.audio(audio, message.getAudioMime()));
        }
        byte[] image = decodeBase64(message.getImage());
        if (image != null) {
            media.add(MediaPart.image(image, message.getImageMime()));
        }
        byte[] video = decodeBase64(message.getVideo());
        if (video != null) {
            media.add(MediaPart.video(video, message.getVideoMime()));
        }
        if (media.isEmpty() && !hasText(message.getText())) {
            return Flux.just(ServerMessage.error(requestId, ErrorCode.INVALID_MEDIA,
                    "Multimodal message has no usable text or media"));
        }
        return responseCycle.run(context, requestId, new TurnInput(message.getText(), media));
    }

    private Flux<ServerMessage> handleZoneUpdate(SessionContext context, String requestId, ClientMessage message) {
        String zoneName = message.getZoneName();
        if (zoneName == null || zoneName.isBlank()) {
            log.warn("Ignoring zone_update {} without a zone name", requestId);
            return Flux.empty();
        }
        ZoneCategory category = ZoneCategory.fromValue(message.getCategory());
        String action = message.getAction() == null ? "" : message.getAction().toLowerCase(Locale.ROOT);
        switch (action) {
            case "enter" -> {
                String previous = context.getCurrentZone();
                context.setCurrentZone(zoneName);
                sideEffectPersister.zoneEntered(context.getSessionId(), previous, zoneName, category);
            }
            case "leave" -> {
                if (zoneName.equalsIgnoreCase(context.getCurrentZone())) {
                    context.setCurrentZone(null);
                }
                sideEffectPersister.zoneLeft(context.getSessionId(), zoneName);
            }
            case "discover" -> sideEffectPersister.zoneDiscovered(context.getSessionId(), zoneName, category);
            default -> log.warn("Ignoring zone_update {} with unknown action '{}'", requestId, message.getAction());
        }
        return Flux.empty();
    }

    private Flux<ServerMessage> handlePersonDetected(SessionContext context, ClientMessage message) {
        if (Boolean.TRUE.equals(message.getKnown()) && message.getPersonId() != null) {
            context.identify(message.getPersonId(), message.getConfidence());
            if (context.isIdentified()) {
                sideEffectPersister.personSeen(context.getSessionId(), context.getPersonId());
            }
        } else {
            context.identify(null, null);
        }
        return Flux.empty();
    }

    private ClientMessage parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, ClientMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Invalid JSON message: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static byte[] decodeBase64(String data) {
        if (data == null || data.isBlank()) {
            return null;
        }
        try {
            byte[] decoded = Base64.getDecoder().decode(WHITESPACE.matcher(data).replaceAll(""));
            return decoded.length == 0 ? null : decoded;
        } catch (IllegalArgumentException e) {
            log.warn("Undecodable base64 payload: {}", e.getMessage());
            return null;
        }
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
