package com.chainwright.core.agent;

import com.chainwright.core.model.Domain;
import com.chainwright.core.wave.WavePhase;

/**
 * Closed set of spawnable agent kinds. Every kind is executed through the single
 * {@link AgentExecutor} interface; the kind only selects role, domain and wave placement.
 */
public enum AgentKind {
    ARCHITECT(Domain.ARCHITECTURE, WavePhase.FOUNDATION,
            "a software architect who defines structure, boundaries and integration points"),
    ANALYZER(Domain.ANALYSIS, WavePhase.FOUNDATION,
            "an analyst who surfaces assumptions, risks, dependencies and open questions"),
    BACKEND(Domain.BACKEND, WavePhase.FOUNDATION,
            "a backend engineer focused on services, APIs, data models and persistence"),
    FRONTEND(Domain.FRONTEND, WavePhase.ENHANCEMENT,
            "a frontend engineer focused on components, user flows, accessibility and state"),
    SECURITY(Domain.SECURITY, WavePhase.ENHANCEMENT,
            "a security engineer focused on threats, authentication, authorization and data protection"),
    PERFORMANCE(Domain.PERFORMANCE, WavePhase.OPTIMIZATION,
            "a performance engineer focused on latency, throughput, caching and capacity"),
    SCRIBE(Domain.DOCUMENTATION, WavePhase.OPTIMIZATION,
            "a technical writer who makes the document complete, consistent and readable");

    private final Domain domain;
    private final WavePhase phase;
    private final String role;

    AgentKind(Domain domain, WavePhase phase, String role) {
        this.domain = domain;
        this.phase = phase;
        this.role = role;
    }

    public Domain domain() {
        return domain;
    }

    /** Wave this kind is batched into when a stage runs in multi-wave mode. */
    public WavePhase phase() {
        return phase;
    }

    public String role() {
        return role;
    }
}
