package com.chainwright.core.events;

import com.chainwright.core.model.StageId;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * An event emitted during a chain run, consumed by the CLI and any in-process observers.
 *
 * @param eventType event type (e.g. "run.created", "stage.entered", "agent.failed")
 * @param runId     the run this event belongs to
 * @param stage     the stage this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ChainEvent(
    String eventType,
    String runId,
    String stage,
    Map<String, Object> payload,
    Instant timestamp
) {
    private static final Set<String> TERMINAL = Set.of("run.completed", "run.failed", "run.aborted");

    private static final Set<String> WARNINGS = Set.of(
            "agent.failed", "scoring.ambiguity", "wave.miscalculation", "capability.fallback",
            "remediation.requested");

    public static ChainEvent of(String eventType, String runId, String stage, Map<String, Object> payload) {
        return new ChainEvent(eventType, runId, stage, payload == null ? Map.of() : payload, Instant.now());
    }

    /** Whether the run ends with this event. */
    public boolean isTerminal() {
        return TERMINAL.contains(eventType);
    }

    /** Degraded-path events worth surfacing even when the run is not watched in full. */
    public boolean isWarning() {
        return WARNINGS.contains(eventType);
    }

    /** Matches the events raised while the run is at the given stage. */
    public static Predicate<ChainEvent> forStage(StageId stage) {
        return e -> stage.name().equals(e.stage());
    }
}
