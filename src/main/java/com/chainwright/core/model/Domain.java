package com.chainwright.core.model;

/**
 * Project domains scored by the context analyzer. Each {@link com.chainwright.core.agent.AgentKind}
 * specialises in exactly one domain.
 */
public enum Domain {
    FRONTEND,
    BACKEND,
    SECURITY,
    PERFORMANCE,
    ARCHITECTURE,
    ANALYSIS,
    DOCUMENTATION
}
