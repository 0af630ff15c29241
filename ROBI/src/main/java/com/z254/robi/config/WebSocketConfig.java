package com.z254.robi.config;

import com.z254.robi.api.websocket.CompanionWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;

import java.util.Map;

/**
 * WebSocket configuration for ROBI.
 * Exposes the device session endpoint.
 */
@Configuration
public class WebSocketConfig {

    @Bean
    public WebSocketHandlerAdapter handlerAdapter(RobiProperties robiProperties) {
        int maxFrameBytes = robiProperties.getSession().getMaxMessageBytes();
        ReactorNettyRequestUpgradeStrategy upgradeStrategy = new ReactorNettyRequestUpgradeStrategy(
                () -> WebsocketServerSpec.builder().maxFramePayloadLength(maxFrameBytes));
        return new WebSocketHandlerAdapter(new HandshakeWebSocketService(upgradeStrategy));
    }

    @Bean
    public HandlerMapping webSocketHandlerMapping(CompanionWebSocketHandler companionHandler,
                                                  RobiProperties robiProperties) {
        Map<String, WebSocketHandler> map = Map.of(robiProperties.getSession().getPath(), companionHandler);

        SimpleUrlHandlerMapping handlerMapping = new SimpleUrlHandlerMapping();
        handlerMapping.setOrder(1);
        handlerMapping.setUrlMap(map);
        return handlerMapping;
    }
}
