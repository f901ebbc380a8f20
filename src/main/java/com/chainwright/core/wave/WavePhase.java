package com.chainwright.core.wave;

/**
 * Sequential waves of a multi-wave stage. Each wave ends with a checkpointed context
 * update and a checkpoint gate pass.
 */
public enum WavePhase {
    FOUNDATION,
    ENHANCEMENT,
    OPTIMIZATION
}
