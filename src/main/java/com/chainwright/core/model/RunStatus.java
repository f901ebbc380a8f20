package com.chainwright.core.model;

/**
 * Lifecycle status of a chain run.
 */
public enum RunStatus {
    IN_PROGRESS,     // Includes runs waiting on a remediation request
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
