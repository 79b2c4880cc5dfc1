package io.fleethive.commander.app;

import io.fleethive.controlplane.connection.TransportType;
import io.fleethive.controlplane.protocol.AgentMessageCodec;
import io.fleethive.controlplane.protocol.AgentToServer;
import io.fleethive.controlplane.protocol.ServerErrorResponse;
import io.fleethive.controlplane.protocol.ServerToAgent;
import io.fleethive.controlplane.session.SessionHandler;
import io.fleethive.controlplane.session.SessionState;
import io.fleethive.fleet.error.AlreadyExistsException;
import io.fleethive.fleet.error.ProtocolException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain HTTP polling transport. Each agent keeps one logical connection, {@code http:<instanceUid>},
 * which lives for as long as the agent keeps polling within the liveness threshold.
 */
@RestController
public class OpampHttpController {

    private static final Logger log = LoggerFactory.getLogger(OpampHttpController.class);
    static final String CONNECTION_PREFIX = "http:";

    private final SessionHandler sessions;
    private final AgentMessageCodec codec;

    public OpampHttpController(SessionHandler sessions, AgentMessageCodec codec) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @PostMapping(value = WebSocketConfig.OPAMP_PATH,
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> poll(@RequestBody(required = false) String payload) {
        AgentToServer message;
        try {
            message = codec.decode(payload);
            if (message.instanceUid() == null || message.instanceUid().isBlank()) {
                throw new ProtocolException("HTTP transport requires an instance uid on every message");
            }
        } catch (ProtocolException e) {
            log.warn("[OPAMP] rejected HTTP poll: {}", e.getMessage());
            return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(codec.encode(ServerToAgent.error(null, ServerErrorResponse.badRequest())));
        }
        String instanceUid = message.instanceUid();
        String connectionId = CONNECTION_PREFIX + instanceUid;
        if (sessions.state(connectionId) == SessionState.CLOSED) {
            try {
                sessions.onConnect(connectionId, TransportType.HTTP);
            } catch (AlreadyExistsException e) {
                log.debug("[OPAMP] concurrent first poll for connection id={}", connectionId);
            }
        }
        Optional<ServerToAgent> reply = sessions.onMessage(connectionId, message);
        return reply
            .map(body -> ResponseEntity.ok(codec.encode(body)))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
