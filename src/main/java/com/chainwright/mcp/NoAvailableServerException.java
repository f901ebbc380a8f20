package com.chainwright.mcp;

/**
 * No healthy server with a free lease slot serves the requested capability.
 * Callers apply the capability's fallback chain.
 */
public class NoAvailableServerException extends RuntimeException {

    private final String capability;

    public NoAvailableServerException(String capability, String message) {
        super(message);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
