package com.company.silencing.exception;

import com.company.silencing.service.ManagerState;

public class SilenceManagerStateException extends SilenceException {

    private final ManagerState state;

    public SilenceManagerStateException(String message, ManagerState state) {
        super(message + " (state: " + state + ")");
        this.state = state;
    }

    public ManagerState getState() {
        return state;
    }
}
