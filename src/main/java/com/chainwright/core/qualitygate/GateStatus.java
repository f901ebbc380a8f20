package com.chainwright.core.qualitygate;

public enum GateStatus {
    PASSED,
    /** Below threshold on a non-required gate; never blocks. */
    WARNING,
    FAILED,
    /** Not run because a dependency did not pass. */
    BLOCKED
}
