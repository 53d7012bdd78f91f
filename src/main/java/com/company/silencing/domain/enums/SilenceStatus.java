package com.company.silencing.domain.enums;

import java.time.Instant;

public enum SilenceStatus {
    PENDING("pending"),
    ACTIVE("active"),
    EXPIRED("expired");

    private final String value;

    SilenceStatus(String value) {
        this.value = value;
    }

    /**
     * Database and wire representation (lower case, Alertmanager compatible)
     */
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == EXPIRED;
    }

    /**
     * Derive the status of a silence window at the given instant.
     * pending: now < startsAt, active: startsAt <= now < endsAt, expired: now >= endsAt
     */
    public static SilenceStatus at(Instant startsAt, Instant endsAt, Instant now) {
        if (now.isBefore(startsAt)) {
            return PENDING;
        }
        if (now.isBefore(endsAt)) {
            return ACTIVE;
        }
        return EXPIRED;
    }

    public static SilenceStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Silence status must not be null");
        }
        for (SilenceStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown silence status: " + value);
    }
}
