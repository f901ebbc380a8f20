package com.chainwright.core.agent;

/**
 * An agent instance could not be started or did not produce output.
 */
public class AgentSpawnException extends RuntimeException {

    public AgentSpawnException(String message) {
        super(message);
    }

    public AgentSpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
