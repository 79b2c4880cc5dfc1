package io.fleethive.commander.app;

import io.fleethive.controlplane.connection.TransportType;
import io.fleethive.controlplane.protocol.ServerToAgent;
import io.fleethive.controlplane.session.SessionHandler;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Agent transport over WebSocket: one JSON text frame per protocol message in each direction.
 * <p>
 * The WebSocket session id doubles as the connection id in the registry.
 */
@Component
public class OpampWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(OpampWebSocketHandler.class);
    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final SessionHandler sessions;
    private final Map<String, WebSocketSession> open = new ConcurrentHashMap<>();

    public OpampWebSocketHandler(SessionHandler sessions) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketSession decorated =
            new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        open.put(session.getId(), decorated);
        sessions.onConnect(session.getId(), TransportType.WEBSOCKET);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        Optional<ServerToAgent> reply = sessions.onMessage(session.getId(), message.getPayload());
        if (reply.isEmpty()) {
            return;
        }
        WebSocketSession target = open.getOrDefault(session.getId(), session);
        if (target.isOpen()) {
            target.sendMessage(new TextMessage(sessions.codec().encode(reply.get())));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[OPAMP] transport error on connection id={}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        open.remove(session.getId());
        sessions.onClose(session.getId());
        log.debug("[OPAMP] websocket closed id={} status={}", session.getId(), status);
    }

    /**
     * Closes the sockets of connections whose sessions were already ended by the server.
     */
    public void disconnect(Collection<String> connectionIds) {
        for (String id : connectionIds) {
            WebSocketSession session = open.remove(id);
            if (session == null || !session.isOpen()) {
                continue;
            }
            try {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException e) {
                log.warn("[OPAMP] failed to close websocket id={}: {}", id, e.getMessage());
            }
        }
    }

    public int openSockets() {
        return open.size();
    }
}
