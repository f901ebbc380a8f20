package com.chainwright.core.qualitygate;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable outcome of one gate invocation.
 *
 * @param gateId     the gate
 * @param status     resulting status
 * @param score      combined score in [0,1]
 * @param threshold  the gate threshold
 * @param required   whether the gate blocks the stage on failure
 * @param breakdown  per checker/server score, e.g. {@code checker:structure -> 0.8}
 * @param findings   free-text findings
 * @param durationMs wall time spent
 */
public record GateResult(
    String gateId,
    GateStatus status,
    double score,
    double threshold,
    boolean required,
    Map<String, Double> breakdown,
    List<String> findings,
    long durationMs
) implements Serializable {
    public GateResult {
        breakdown = breakdown == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static GateResult blocked(QualityGate gate, boolean required, List<String> unmetDependencies) {
        return new GateResult(gate.id(), GateStatus.BLOCKED, 0.0, gate.threshold(), required, Map.of(),
                List.of("blocked by unmet dependencies " + unmetDependencies), 0);
    }

    /** Required and not passed: blocks the stage transition. */
    public boolean blocking() {
        return required && (status == GateStatus.FAILED || status == GateStatus.BLOCKED);
    }
}
