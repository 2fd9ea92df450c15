package com.shlawgathon.pulse.backend.config;

import com.shlawgathon.pulse.backend.websocket.TeamStatusWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TeamStatusWebSocketHandler teamStatusWebSocketHandler;

    @Value("${frontend.url:http://localhost:3000}")
    private String frontendUrl;

    public WebSocketConfig(TeamStatusWebSocketHandler teamStatusWebSocketHandler) {
        this.teamStatusWebSocketHandler = teamStatusWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(teamStatusWebSocketHandler, "/ws/team")
                .setAllowedOrigins(frontendUrl);
    }
}
