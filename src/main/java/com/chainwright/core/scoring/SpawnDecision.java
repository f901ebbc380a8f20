package com.chainwright.core.scoring;

/**
 * Decision bucket for one scored agent at one stage.
 */
public enum SpawnDecision {
    /** Spawned by the coordinator without asking. */
    AUTO_SPAWN,
    /** Surfaced to the caller as a suggestion, not spawned. */
    SUGGEST,
    /** Orchestrator-only: no agent is spawned for this domain. */
    SKIP
}
