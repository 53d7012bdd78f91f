package com.company.silencing.exception;

/**
 * Base type for all silencing failures surfaced to callers.
 */
public abstract class SilenceException extends RuntimeException {

    protected SilenceException(String message) {
        super(message);
    }

    protected SilenceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same call later and expect a different outcome.
     */
    public boolean isRetryable() {
        return false;
    }
}
