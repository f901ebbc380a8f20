package com.chainwright.mcp;

/**
 * Result of a capability invocation, possibly served by a fallback capability or degraded to nothing.
 *
 * @param capability        the capability originally requested
 * @param servedCapability  the capability that actually answered, {@code null} when degraded
 * @param serverId          the answering server, {@code null} when degraded
 * @param result            tool output text, empty when degraded
 * @param latencyMs         call latency
 * @param success           whether a server answered successfully
 * @param confidenceReduced whether the answer came from a fallback or is missing
 */
public record CapabilityResponse(
    String capability,
    String servedCapability,
    String serverId,
    String result,
    long latencyMs,
    boolean success,
    boolean confidenceReduced
) {
    public static CapabilityResponse degraded(String capability) {
        return new CapabilityResponse(capability, null, null, "", 0, false, true);
    }

    public boolean degraded() {
        return servedCapability == null;
    }
}
