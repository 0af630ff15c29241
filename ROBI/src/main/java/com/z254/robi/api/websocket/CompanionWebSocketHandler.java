package com.z254.robi.api.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.session.CompanionSessionEngine;
import com.z254.robi.session.InboundFrame;
import com.z254.robi.session.ProtocolViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * WebSocket endpoint for robot devices.
 * Adapts frames to the session engine and writes its messages back as JSON text frames.
 * Handshake violations close the connection with 1008.
 */
@Component
@Slf4j
public class CompanionWebSocketHandler implements WebSocketHandler {

    private final CompanionSessionEngine sessionEngine;
    private final ObjectMapper objectMapper;

    public CompanionWebSocketHandler(CompanionSessionEngine sessionEngine, ObjectMapper objectMapper) {
        this.sessionEngine = sessionEngine;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String remoteAddress = remoteAddressOf(session);
        log.info("WebSocket connection opened: {} from {}", session.getId(), remoteAddress);

        Flux<InboundFrame> inbound = session.receive().map(CompanionWebSocketHandler::toFrame);

        Flux<WebSocketMessage> outbound = sessionEngine.run(inbound, remoteAddress)
                .concatMap(message -> serialize(message).map(session::textMessage));

        return session.send(outbound)
                .onErrorResume(ProtocolViolationException.class, e -> session.close(
                        CloseStatus.POLICY_VIOLATION.withReason(e.getMessage())))
                .doFinally(signalType ->
                        log.info("WebSocket connection closed: {} - {}", session.getId(), signalType));
    }

    static InboundFrame toFrame(WebSocketMessage message) {
        if (message.getType() == WebSocketMessage.Type.BINARY) {
            DataBuffer payload = message.getPayload();
            byte[] bytes = new byte[payload.readableByteCount()];
            payload.read(bytes);
            return InboundFrame.binary(bytes);
        }
        return InboundFrame.text(message.getPayloadAsText());
    }

    private Mono<String> serialize(ServerMessage message) {
        try {
            return Mono.just(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {} message: {}", message.getType(), e.getMessage());
            return Mono.empty();
        }
    }

    private static String remoteAddressOf(WebSocketSession session) {
        InetSocketAddress address = session.getHandshakeInfo() != null
                ? session.getHandshakeInfo().getRemoteAddress()
                : null;
        return address != null ? address.toString() : "unknown";
    }
}
