package io.fleethive.controlplane.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Set;

/**
 * Outbound protocol message. Empty parts are omitted on the wire.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ServerToAgent(String instanceUid,
                            RemoteConfigOffer remoteConfig,
                            List<CommandDelivery> commands,
                            Set<ServerFlag> flags,
                            ServerErrorResponse errorResponse) {

    public ServerToAgent {
        commands = commands == null ? List.of() : List.copyOf(commands);
        flags = flags == null || flags.isEmpty() ? Set.of() : Set.copyOf(flags);
    }

    public static ServerToAgent error(String instanceUid, ServerErrorResponse error) {
        return new ServerToAgent(instanceUid, null, List.of(), Set.of(), error);
    }

    public boolean hasFlag(ServerFlag flag) {
        return flags.contains(flag);
    }
}
