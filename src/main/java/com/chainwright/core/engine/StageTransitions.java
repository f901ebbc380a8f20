package com.chainwright.core.engine;

import com.chainwright.core.model.StageId;

/**
 * The stage state machine. Stages only move forward; the single exception is the
 * remediation transition, which re-opens the stage that is already current.
 */
public final class StageTransitions {

    private StageTransitions() {}

    /**
     * Validates an advance from {@code from} to {@code to}.
     *
     * @param to the next stage, or {@code null} when {@code from} is the last stage
     * @throws IllegalStateException if the move does not go strictly forward
     */
    public static void requireForward(StageId from, StageId to) {
        if (from == null) {
            throw new IllegalStateException("No current stage to advance from");
        }
        if (to != null && to.ordinal() <= from.ordinal()) {
            throw new IllegalStateException("Illegal stage transition " + from + " -> " + to);
        }
    }

    /**
     * Validates a remediation, which may only target the stage that is currently open.
     */
    public static void requireRemediation(StageId current, StageId target) {
        if (current != target) {
            throw new IllegalStateException("Remediation may only re-enter the current stage " + current
                    + ", not " + target);
        }
    }
}
