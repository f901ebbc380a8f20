package com.chainwright.core.agent;

import java.util.List;

/**
 * Capability profile of a spawnable agent kind, loaded from the chain catalog.
 *
 * @param kind              the agent kind this profile describes
 * @param domainKeywords    keywords that indicate the agent is relevant to stage content
 * @param filePatterns      file glob patterns (e.g. {@code *.tsx}) that indicate relevance in the project
 * @param dirPatterns       directory names (e.g. {@code components}) that indicate relevance in the project
 * @param mcpCapabilityTags MCP capabilities the agent consults while working
 * @param allowedTools      tool names the agent may use
 * @param priority          conflict and aggregation rank, lower wins
 */
public record AgentDescriptor(
    AgentKind kind,
    List<String> domainKeywords,
    List<String> filePatterns,
    List<String> dirPatterns,
    List<String> mcpCapabilityTags,
    List<String> allowedTools,
    int priority
) {
    public AgentDescriptor {
        if (kind == null) {
            throw new IllegalArgumentException("Agent descriptor requires a kind");
        }
        domainKeywords = domainKeywords == null ? List.of() : List.copyOf(domainKeywords);
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        dirPatterns = dirPatterns == null ? List.of() : List.copyOf(dirPatterns);
        mcpCapabilityTags = mcpCapabilityTags == null ? List.of() : List.copyOf(mcpCapabilityTags);
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
    }
}
