package com.chainwright.core.qualitygate;

/**
 * Deterministic check logic behind one or more quality gates. Implementations must return the
 * same score for byte-identical input.
 */
public interface GateChecker {

    /** Checker id referenced by {@link QualityGate#checker()}. */
    String id();

    GateCheck check(GateInput input);
}
