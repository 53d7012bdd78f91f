package com.company.silencing.exception;

/**
 * Storage or connection failure. Never retried internally; callers should back off and retry.
 */
public class StorageUnavailableException extends SilenceException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super("Silence storage unavailable during " + operation, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
