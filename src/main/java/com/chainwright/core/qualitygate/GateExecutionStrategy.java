package com.chainwright.core.qualitygate;

/**
 * Scheduling strategy for a batch of quality gates.
 * <p>
 * SEQUENTIAL: dependency order, stops at the first required failure.
 * PARALLEL: dependency levels, each level batched concurrently.
 * ADAPTIVE: the stage's gate subset from the static stage-to-gates mapping, run as PARALLEL.
 */
public enum GateExecutionStrategy {
    SEQUENTIAL,
    PARALLEL,
    ADAPTIVE
}
