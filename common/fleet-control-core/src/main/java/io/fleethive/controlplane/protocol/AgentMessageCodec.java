package io.fleethive.controlplane.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fleethive.fleet.error.ProtocolException;
import java.util.Objects;

/**
 * JSON framing of protocol messages. Transports hand over text frames; the session handler only
 * ever sees decoded records.
 */
public final class AgentMessageCodec {

    private final ObjectMapper mapper;

    public AgentMessageCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public AgentToServer decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new ProtocolException("empty message");
        }
        try {
            AgentToServer message = mapper.readValue(payload, AgentToServer.class);
            if (message == null) {
                throw new ProtocolException("empty message");
            }
            return message;
        } catch (JsonProcessingException e) {
            throw new ProtocolException("unparseable message: " + e.getOriginalMessage(), e);
        }
    }

    public String encode(ServerToAgent message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode reply", e);
        }
    }
}
