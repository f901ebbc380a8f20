package com.chainwright.mcp;

import com.chainwright.core.agent.AgentKind;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An exclusive capacity slot on one MCP server, held for the duration of one capability call.
 * Closing is idempotent; a lease released by run cancellation can still be closed by its holder.
 */
public final class ServerLease implements AutoCloseable {

    private final McpServerSelector selector;
    private final McpServerDescriptor server;
    private final String capability;
    private final String holderId;
    private final AgentKind agentKind;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ServerLease(McpServerSelector selector, McpServerDescriptor server, String capability,
                String holderId, AgentKind agentKind) {
        this.selector = selector;
        this.server = server;
        this.capability = capability;
        this.holderId = holderId;
        this.agentKind = agentKind;
    }

    public McpServerDescriptor server() {
        return server;
    }

    public String capability() {
        return capability;
    }

    public String holderId() {
        return holderId;
    }

    public AgentKind agentKind() {
        return agentKind;
    }

    public boolean isReleased() {
        return released.get();
    }

    /** Returns true the first time only. */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        selector.release(this);
    }

    @Override
    public String toString() {
        return "ServerLease[" + server.id() + "/" + capability + " held by " + holderId + "]";
    }
}
