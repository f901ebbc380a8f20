package com.chainwright.core.qualitygate;

import java.util.List;

/**
 * A request to evaluate gates for one stage output.
 *
 * @param runId    owning run, used for lease holders and events
 * @param input    the content under test
 * @param gateIds  gates to run under SEQUENTIAL or PARALLEL; ADAPTIVE takes the catalog mapping instead
 * @param strategy strategy to use, {@code null} for the configured default
 */
public record GateRequest(
    String runId,
    GateInput input,
    List<String> gateIds,
    GateExecutionStrategy strategy
) {
    public GateRequest {
        gateIds = gateIds == null ? List.of() : List.copyOf(gateIds);
    }

    public static GateRequest forStage(String runId, GateInput input, GateExecutionStrategy strategy) {
        return new GateRequest(runId, input, input.stage().allGates(), strategy);
    }
}
