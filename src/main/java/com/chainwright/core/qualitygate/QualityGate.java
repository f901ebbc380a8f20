package com.chainwright.core.qualitygate;

import java.util.List;

/**
 * A named, thresholded validation check, loaded from the chain catalog.
 *
 * @param id                     unique gate id (e.g. "security")
 * @param checker                id of the {@link GateChecker} that scores the gate
 * @param requiredCapabilityTags MCP capabilities whose structured response is blended into the score
 * @param threshold              minimum passing score in [0,1]
 * @param timeoutMs              execution budget; a gate that exceeds it scores 0
 * @param required               whether a failure blocks the stage transition
 * @param dependsOn              gates that must pass before this one runs
 */
public record QualityGate(
    String id,
    String checker,
    List<String> requiredCapabilityTags,
    double threshold,
    long timeoutMs,
    boolean required,
    List<String> dependsOn
) {
    public static final long DEFAULT_TIMEOUT_MS = 30_000;

    public QualityGate {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Quality gate requires an id");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Gate " + id + " threshold must be in [0,1], was " + threshold);
        }
        checker = checker == null || checker.isBlank() ? id : checker;
        requiredCapabilityTags = requiredCapabilityTags == null ? List.of() : List.copyOf(requiredCapabilityTags);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        timeoutMs = timeoutMs <= 0 ? DEFAULT_TIMEOUT_MS : timeoutMs;
    }
}
