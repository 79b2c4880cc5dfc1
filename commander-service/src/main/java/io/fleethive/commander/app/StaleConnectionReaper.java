package io.fleethive.commander.app;

import io.fleethive.controlplane.session.SessionHandler;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ends sessions of agents that stopped talking and drops their sockets.
 */
@Component
public class StaleConnectionReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleConnectionReaper.class);

    private final SessionHandler sessions;
    private final OpampWebSocketHandler webSockets;

    public StaleConnectionReaper(SessionHandler sessions, OpampWebSocketHandler webSockets) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.webSockets = Objects.requireNonNull(webSockets, "webSockets");
    }

    @Scheduled(
        initialDelayString = "${fleethive.commander.connections.reaper-interval:PT15S}",
        fixedDelayString = "${fleethive.commander.connections.reaper-interval:PT15S}")
    public void reap() {
        try {
            List<String> closed = sessions.closeStaleSessions();
            if (!closed.isEmpty()) {
                log.info("[OPAMP] reaped {} stale connection(s)", closed.size());
                webSockets.disconnect(closed);
            }
        } catch (RuntimeException ex) {
            log.warn("[OPAMP] stale connection sweep failed: {}", ex.getMessage(), ex);
        }
    }
}
