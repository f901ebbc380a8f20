package com.chainwright.mcp;

public enum ServerHealth {
    /** No health check has completed yet; eligible for selection. */
    UNKNOWN,
    HEALTHY,
    /** Excluded from selection until a health check succeeds. */
    UNHEALTHY;

    public boolean selectable() {
        return this != UNHEALTHY;
    }
}
