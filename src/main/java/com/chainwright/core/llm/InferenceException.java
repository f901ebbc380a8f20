package com.chainwright.core.llm;

/**
 * Thrown when the inference provider fails or returns no content.
 */
public class InferenceException extends RuntimeException {
    public InferenceException(String message) {
        super(message);
    }

    public InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
