package com.chainwright.core.wave;

import java.io.Serializable;

/**
 * The five raw complexity sub-scores a wave decision is computed from, each in [0,1].
 */
public record ComplexityProfile(
    double chainComplexity,
    double agentCoordination,
    double implementationScale,
    double projectContext,
    double qualityRequirements
) implements Serializable {
    public ComplexityProfile {
        chainComplexity = clamp(chainComplexity);
        agentCoordination = clamp(agentCoordination);
        implementationScale = clamp(implementationScale);
        projectContext = clamp(projectContext);
        qualityRequirements = clamp(qualityRequirements);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
