package com.chainwright.core.wave;

public enum WaveStrategy {
    SINGLE_PASS,
    PROGRESSIVE,
    CONTEXT_DRIVEN,
    AGENT_COORDINATED,
    /** Multi-wave with blocking checkpoint gates between waves. */
    VALIDATION;

    public boolean multiWave() {
        return this != SINGLE_PASS;
    }
}
