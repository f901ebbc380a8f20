package com.chainwright.core.agent;

import java.io.Serializable;

/**
 * A section that lost a region conflict to a higher-priority agent; kept for the caller, not merged.
 */
public record SecondarySuggestion(String region, AgentKind from, AgentKind overriddenBy, String content)
        implements Serializable {}
