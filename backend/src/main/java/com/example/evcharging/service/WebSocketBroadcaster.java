package com.example.evcharging.service;

import com.example.evcharging.store.StoreChangeListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Pushes realtime-store changes to every connected {@code /ws} client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebSocketBroadcaster implements StoreChangeListener {

    private final Set<WebSocketSession> sessions = new CopyOnWriteArraySet<>();
    private final ObjectMapper objectMapper;

    public void addSession(WebSocketSession session) {
        sessions.add(session);
        log.info("WebSocket session added. Total sessions: {}", sessions.size());
    }

    public void removeSession(WebSocketSession session) {
        sessions.remove(session);
        log.info("WebSocket session removed. Total sessions: {}", sessions.size());
    }

    public int getSessionCount() {
        return sessions.size();
    }

    @Override
    public void onChange(String path, Map<String, Object> document) {
        if (sessions.isEmpty()) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", path);
        data.put("deleted", document == null);
        data.put("document", document);
        broadcast("STORE_UPDATE", data);
    }

    private void broadcast(String type, Object data) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("data", data);
        message.put("timestamp", System.currentTimeMillis());

        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} message", type, e);
            return;
        }

        TextMessage textMessage = new TextMessage(json);
        sessions.forEach(session -> {
            try {
                if (session.isOpen()) {
                    synchronized (session) {
                        session.sendMessage(textMessage);
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to send {} to session {}: {}", type, session.getId(), e.getMessage());
            }
        });
    }
}
