package io.fleethive.controlplane.session;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Per-connection protocol state. Every field is guarded by the session's own monitor.
 */
final class AgentSession {

    private final String connectionId;
    private SessionState state = SessionState.CONNECTED;
    private String instanceUid;
    private Map<String, String> identifyingAttributes = Map.of();
    private Long lastSequence;
    private String reportedConfigHash;
    private String effectiveGroup;
    private final Set<UUID> delivered = new HashSet<>();

    AgentSession(String connectionId) {
        this.connectionId = connectionId;
    }

    String connectionId() {
        return connectionId;
    }

    SessionState state() {
        return state;
    }

    boolean isClosed() {
        return state == SessionState.CLOSED;
    }

    void identify(String instanceUid) {
        this.instanceUid = instanceUid;
        this.state = SessionState.IDENTIFIED;
    }

    void close() {
        this.state = SessionState.CLOSED;
    }

    String instanceUid() {
        return instanceUid;
    }

    Map<String, String> identifyingAttributes() {
        return identifyingAttributes;
    }

    void identifyingAttributes(Map<String, String> attributes) {
        this.identifyingAttributes = attributes == null ? Map.of() : attributes;
    }

    Long lastSequence() {
        return lastSequence;
    }

    void lastSequence(long sequence) {
        this.lastSequence = sequence;
    }

    String reportedConfigHash() {
        return reportedConfigHash;
    }

    void reportedConfigHash(String hash) {
        this.reportedConfigHash = hash;
    }

    String effectiveGroup() {
        return effectiveGroup;
    }

    void effectiveGroup(String group) {
        this.effectiveGroup = group;
    }

    boolean wasDelivered(UUID commandId) {
        return delivered.contains(commandId);
    }

    void markDelivered(UUID commandId) {
        delivered.add(commandId);
    }

    /**
     * Forgets what the previous agent process was sent and reported, keeping the identity.
     */
    void restart(long sequence) {
        this.lastSequence = sequence;
        this.reportedConfigHash = null;
        this.delivered.clear();
    }
}
