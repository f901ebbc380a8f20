package com.chainwright.core.agent;

/**
 * Lifecycle of an {@link AgentInstance}.
 */
public enum InstanceState {
    SPAWNED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
