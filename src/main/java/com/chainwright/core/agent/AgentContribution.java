package com.chainwright.core.agent;

import java.util.List;

/**
 * One agent's part in an aggregated stage result.
 */
public record AgentContribution(
    AgentKind kind,
    String instanceId,
    InstanceState state,
    int attempts,
    List<String> sectionsWon,
    boolean confidenceReduced,
    String error
) {
    public AgentContribution {
        sectionsWon = sectionsWon == null ? List.of() : List.copyOf(sectionsWon);
    }
}
