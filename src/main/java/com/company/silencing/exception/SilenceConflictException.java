package com.company.silencing.exception;

/**
 * Optimistic lock mismatch: the silence changed since the caller read it.
 * Re-fetch and retry.
 */
public class SilenceConflictException extends SilenceException {

    private final String silenceId;

    public SilenceConflictException(String silenceId) {
        super("Silence " + silenceId + " was modified concurrently");
        this.silenceId = silenceId;
    }

    public String getSilenceId() {
        return silenceId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
