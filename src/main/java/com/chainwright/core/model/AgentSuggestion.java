package com.chainwright.core.model;

import com.chainwright.core.agent.AgentKind;

import java.io.Serializable;

/**
 * An agent that scored in the suggest bucket for a stage. Surfaced to the caller, never auto-spawned.
 */
public record AgentSuggestion(StageId stage, AgentKind agent, double score, String reason) implements Serializable {}
