package com.chainwright.core.wave;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a complexity assessment.
 *
 * @param profile  the raw sub-scores
 * @param total    weighted wave score in [0,1]
 * @param strategy chosen execution strategy
 */
public record WaveDecision(ComplexityProfile profile, double total, WaveStrategy strategy) implements Serializable {

    public static final double CHAIN_COMPLEXITY_WEIGHT = 0.35;
    public static final double AGENT_COORDINATION_WEIGHT = 0.25;
    public static final double IMPLEMENTATION_SCALE_WEIGHT = 0.20;
    public static final double PROJECT_CONTEXT_WEIGHT = 0.15;
    public static final double QUALITY_REQUIREMENTS_WEIGHT = 0.05;

    public static Map<String, Double> weights() {
        var weights = new LinkedHashMap<String, Double>();
        weights.put("chainComplexity", CHAIN_COMPLEXITY_WEIGHT);
        weights.put("agentCoordination", AGENT_COORDINATION_WEIGHT);
        weights.put("implementationScale", IMPLEMENTATION_SCALE_WEIGHT);
        weights.put("projectContext", PROJECT_CONTEXT_WEIGHT);
        weights.put("qualityRequirements", QUALITY_REQUIREMENTS_WEIGHT);
        return weights;
    }

    public boolean multiWave() {
        return strategy.multiWave();
    }

    /** Waves a stage runs in: all three phases for multi-wave, none for single pass. */
    public List<WavePhase> phases() {
        return multiWave() ? List.of(WavePhase.values()) : List.of();
    }

    /** Whether checkpoint gates between waves block the stage. */
    public boolean blockingCheckpoints() {
        return strategy == WaveStrategy.VALIDATION;
    }
}
