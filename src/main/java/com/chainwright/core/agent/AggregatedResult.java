package com.chainwright.core.agent;

import java.util.List;

/**
 * Agent outputs of one stage (or wave) combined in descriptor-priority order.
 *
 * @param content                    merged markdown, empty when no agent completed
 * @param contributions              one entry per instance, in priority order
 * @param secondarySuggestions       sections that lost a region conflict
 * @param partialCoordinationFailure whether any agent failed both attempts, timed out or was cancelled
 * @param confidenceReduced          whether any merged contribution was produced with degraded capabilities
 */
public record AggregatedResult(
    String content,
    List<AgentContribution> contributions,
    List<SecondarySuggestion> secondarySuggestions,
    boolean partialCoordinationFailure,
    boolean confidenceReduced
) {
    public AggregatedResult {
        content = content == null ? "" : content;
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
        secondarySuggestions = secondarySuggestions == null ? List.of() : List.copyOf(secondarySuggestions);
    }

    public static AggregatedResult empty() {
        return new AggregatedResult("", List.of(), List.of(), false, false);
    }

    public boolean hasContent() {
        return !content.isBlank();
    }

    public List<AgentKind> contributors() {
        return contributions.stream().filter(c -> c.state() == InstanceState.COMPLETED)
                .map(AgentContribution::kind).toList();
    }

    public List<AgentKind> failedAgents() {
        return contributions.stream().filter(c -> c.state() != InstanceState.COMPLETED)
                .map(AgentContribution::kind).toList();
    }
}
