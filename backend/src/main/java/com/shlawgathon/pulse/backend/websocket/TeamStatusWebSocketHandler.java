package com.shlawgathon.pulse.backend.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.model.DeveloperState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes developer status changes to every connected team board.
 */
@Component
public class TeamStatusWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TeamStatusWebSocketHandler.class);

    public static final String DEVELOPER_STATUS = "DEVELOPER_STATUS";
    public static final String TEAM_REFRESHED = "TEAM_REFRESHED";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    // sessionId -> session
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public TeamStatusWebSocketHandler(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(session.getId(), session);
        log.info("[WS] Team board connected: {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("[WS] Team board disconnected: {} ({})", session.getId(), status.getCode());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("[WS] Received message: {}", message.getPayload());
    }

    /**
     * Send one developer's recomputed state.
     */
    public void sendDeveloperStatus(DeveloperState state) {
        if (sessions.isEmpty()) {
            return;
        }
        TeamBoardMessage message = TeamBoardMessage.builder()
                .type(DEVELOPER_STATUS)
                .userId(state.getId())
                .developer(state)
                .sentAt(clock.instant())
                .build();
        broadcastMessage(message);
    }

    /**
     * Send the full board after a refresh.
     */
    public void sendTeamRefreshed(List<DeveloperState> states) {
        if (sessions.isEmpty()) {
            return;
        }
        TeamBoardMessage message = TeamBoardMessage.builder()
                .type(TEAM_REFRESHED)
                .developers(states)
                .sentAt(clock.instant())
                .build();
        broadcastMessage(message);
    }

    public int sessionCount() {
        return sessions.size();
    }

    private void broadcastMessage(TeamBoardMessage message) {
        try {
            TextMessage textMessage = new TextMessage(objectMapper.writeValueAsString(message));

            sessions.values().forEach(session -> {
                try {
                    if (session.isOpen()) {
                        synchronized (session) {
                            session.sendMessage(textMessage);
                        }
                    }
                } catch (IOException e) {
                    log.error("[WS] Failed to send message to session: {}", session.getId(), e);
                }
            });
        } catch (Exception e) {
            log.error("[WS] Failed to broadcast {} message", message.getType(), e);
        }
    }
}
