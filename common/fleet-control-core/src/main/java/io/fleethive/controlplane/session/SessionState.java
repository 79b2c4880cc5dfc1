package io.fleethive.controlplane.session;

public enum SessionState {
    /** Transport is open, the agent has not described itself yet. */
    CONNECTED,
    /** The agent sent its instance uid and description; config and commands flow. */
    IDENTIFIED,
    CLOSED
}
