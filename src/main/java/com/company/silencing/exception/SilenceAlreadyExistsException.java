package com.company.silencing.exception;

public class SilenceAlreadyExistsException extends SilenceException {

    public SilenceAlreadyExistsException(String silenceId, Throwable cause) {
        super("Silence already exists: " + silenceId, cause);
    }
}
