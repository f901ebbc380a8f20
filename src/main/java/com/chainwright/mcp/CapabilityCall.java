package com.chainwright.mcp;

import com.chainwright.core.agent.AgentKind;

import java.util.Map;

/**
 * A request to invoke one capability on behalf of an agent instance or gate.
 *
 * @param runId      owning chain run, for events
 * @param holderId   lease holder (agent instance id or gate run id)
 * @param agentKind  requesting agent, {@code null} for gates
 * @param capability requested capability tag
 * @param arguments  tool arguments
 */
public record CapabilityCall(
    String runId,
    String holderId,
    AgentKind agentKind,
    String capability,
    Map<String, Object> arguments
) {
    public CapabilityCall {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
}
