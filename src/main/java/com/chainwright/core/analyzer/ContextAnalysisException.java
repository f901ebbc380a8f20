package com.chainwright.core.analyzer;

/**
 * Thrown when a project root cannot be analysed at all: missing, not a directory,
 * unreadable or empty. Partial failures inside the tree never raise this.
 */
public class ContextAnalysisException extends RuntimeException {

    public ContextAnalysisException(String message) {
        super(message);
    }

    public ContextAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
