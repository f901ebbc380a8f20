package com.chainwright.mcp;

/**
 * Point-in-time view of a server's mutable state, copied out of the {@link ServerRegistry}.
 */
public record ServerStatus(
    McpServerDescriptor descriptor,
    ServerHealth health,
    int consecutiveFailures,
    int activeLeases,
    int samples,
    double successRate,
    double averageLatencyMs
) {
    public boolean hasFreeSlot() {
        return activeLeases < descriptor.maxConcurrentLeases();
    }
}
