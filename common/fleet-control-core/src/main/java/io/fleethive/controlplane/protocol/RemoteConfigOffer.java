package io.fleethive.controlplane.protocol;

import io.fleethive.fleet.model.AgentGroup;
import io.fleethive.fleet.model.RemoteConfig;

/**
 * Remote configuration pushed to an agent, tagged with the group it came from.
 */
public record RemoteConfigOffer(String configHash, String contentType, String body, String agentGroup) {

    public static RemoteConfigOffer from(AgentGroup.Active group) {
        RemoteConfig config = group.remoteConfig();
        return new RemoteConfigOffer(config.hash(), config.contentType(), config.body(), group.name());
    }
}
