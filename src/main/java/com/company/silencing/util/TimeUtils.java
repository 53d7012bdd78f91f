package com.company.silencing.util;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Current instant at millisecond precision. Stored timestamps must round-trip exactly
     * because updated_at is compared for equality on update.
     */
    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static Instant truncate(Instant instant) {
        return instant != null ? instant.truncatedTo(ChronoUnit.MILLIS) : null;
    }

    /**
     * Next optimistic-lock token: now, or one millisecond past the previous token
     * when the clock has not advanced.
     */
    public static Instant nextVersion(Instant previous, Instant now) {
        if (previous == null || now.isAfter(previous)) {
            return now;
        }
        return previous.plusMillis(1);
    }
}
