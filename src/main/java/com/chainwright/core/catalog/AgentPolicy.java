package com.chainwright.core.catalog;

import com.chainwright.core.agent.AgentKind;

import java.util.List;

/**
 * Per-stage agent spawning policy.
 *
 * @param spawningThreshold auto-spawn threshold for this stage; 0 means the configured default
 * @param requiredAgents    agents the stage explicitly requires (full stage-requirement sub-score)
 * @param optionalAgents    agents the stage can use (partial stage-requirement sub-score)
 */
public record AgentPolicy(
    double spawningThreshold,
    List<AgentKind> requiredAgents,
    List<AgentKind> optionalAgents
) {
    public AgentPolicy {
        requiredAgents = requiredAgents == null ? List.of() : List.copyOf(requiredAgents);
        optionalAgents = optionalAgents == null ? List.of() : List.copyOf(optionalAgents);
        if (spawningThreshold < 0.0 || spawningThreshold > 1.0) {
            throw new IllegalArgumentException("spawningThreshold must be in [0,1], was " + spawningThreshold);
        }
    }

    public static AgentPolicy none() {
        return new AgentPolicy(0.0, List.of(), List.of());
    }

    public boolean requires(AgentKind kind) {
        return requiredAgents.contains(kind);
    }

    public boolean allows(AgentKind kind) {
        return optionalAgents.contains(kind);
    }
}
