package com.questrail.microgrid.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the bounds merger. Expired bound sets are dropped lazily on
 * every read and proactively every {@code sweepInterval}.
 */
public record BoundsPolicy(Duration sweepInterval) {

    public BoundsPolicy {
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    public static BoundsPolicy defaults() {
        return new BoundsPolicy(Duration.ofSeconds(1));
    }
}
