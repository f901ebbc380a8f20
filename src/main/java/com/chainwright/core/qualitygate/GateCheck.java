package com.chainwright.core.qualitygate;

import java.util.List;

/**
 * A checker's verdict: a score in [0,1] and its findings.
 */
public record GateCheck(double score, List<String> findings) {

    public GateCheck {
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("Gate check score must be a number");
        }
        score = Math.max(0.0, Math.min(1.0, score));
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static GateCheck of(double score, String... findings) {
        return new GateCheck(score, List.of(findings));
    }
}
