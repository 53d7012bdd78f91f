package com.company.silencing.exception;

public class SilenceNotFoundException extends SilenceException {

    private final String silenceId;

    public SilenceNotFoundException(String silenceId) {
        super("Silence not found: " + silenceId);
        this.silenceId = silenceId;
    }

    public String getSilenceId() {
        return silenceId;
    }
}
