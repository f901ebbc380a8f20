package com.chainwright.mcp;

import java.util.List;

/**
 * Every fallback of a non-degradable capability is exhausted. Fatal for the run.
 */
public class CapabilityUnavailableException extends RuntimeException {

    private final String capability;
    private final List<String> attempted;

    public CapabilityUnavailableException(String capability, List<String> attempted, Throwable cause) {
        super("Capability '" + capability + "' unavailable after trying " + attempted, cause);
        this.capability = capability;
        this.attempted = List.copyOf(attempted);
    }

    public String getCapability() {
        return capability;
    }

    public List<String> getAttempted() {
        return attempted;
    }
}
