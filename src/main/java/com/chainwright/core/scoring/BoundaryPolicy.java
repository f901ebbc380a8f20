package com.chainwright.core.scoring;

/**
 * How a score lying exactly on a threshold is classified.
 */
public enum BoundaryPolicy {
    /** {@code score >= threshold} passes. */
    INCLUSIVE,
    /** {@code score > threshold} passes. */
    EXCLUSIVE;

    /** Tolerance under which two scores are considered equal. */
    public static final double EPSILON = 1e-9;

    public boolean meets(double score, double threshold) {
        if (this == INCLUSIVE) {
            return score >= threshold - EPSILON;
        }
        return score > threshold + EPSILON;
    }

    public static boolean onBoundary(double score, double threshold) {
        return Math.abs(score - threshold) <= EPSILON;
    }
}
