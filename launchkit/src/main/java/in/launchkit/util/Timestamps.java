package in.launchkit.util;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class Timestamps {

    private static final long TEN_MINUTES_MS = Duration.ofMinutes(10).toMillis();

    /**
     * Round up to the next 10-minute UTC boundary; an instant already on a boundary is returned as is.
     */
    public static Instant nextTenMinuteBoundary(Instant now) {
        Instant truncated = now.truncatedTo(ChronoUnit.MILLIS);
        long epochMs = truncated.toEpochMilli();
        long remainder = Math.floorMod(epochMs, TEN_MINUTES_MS);
        if (remainder == 0 && truncated.equals(now)) {
            return now;
        }
        return Instant.ofEpochMilli(epochMs - remainder + TEN_MINUTES_MS);
    }

    private Timestamps() {
        // Utility class
    }
}
