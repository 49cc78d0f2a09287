package com.questrail.microgrid.config;

import java.time.Duration;
import java.util.Objects;

/**
 * WatchdogPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration of the power command watchdog.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>defaultLifetime</b>: lifetime applied when a request carries none.</li>
 *   <li><b>minLifetime</b>/<b>maxLifetime</b>: inclusive range a requested
 *       lifetime must fall into; anything else is rejected.</li>
 *   <li><b>revertRetryDelay</b>: delay before a failed revert-to-zero is
 *       attempted again.</li>
 * </ul>
 */
public record WatchdogPolicy(
        Duration defaultLifetime,
        Duration minLifetime,
        Duration maxLifetime,
        Duration revertRetryDelay
) {
    public WatchdogPolicy {
        Objects.requireNonNull(defaultLifetime, "defaultLifetime");
        Objects.requireNonNull(minLifetime, "minLifetime");
        Objects.requireNonNull(maxLifetime, "maxLifetime");
        Objects.requireNonNull(revertRetryDelay, "revertRetryDelay");

        if (minLifetime.isNegative() || minLifetime.isZero()) {
            throw new IllegalArgumentException("minLifetime must be positive");
        }
        if (maxLifetime.compareTo(minLifetime) < 0) {
            throw new IllegalArgumentException("maxLifetime must be >= minLifetime");
        }
        if (defaultLifetime.compareTo(minLifetime) < 0 || defaultLifetime.compareTo(maxLifetime) > 0) {
            throw new IllegalArgumentException("defaultLifetime must lie within [minLifetime, maxLifetime]");
        }
        if (revertRetryDelay.isNegative()) {
            throw new IllegalArgumentException("revertRetryDelay must be non-negative");
        }
    }

    /**
     * Returns whether a requested lifetime is acceptable.
     */
    public boolean accepts(Duration lifetime) {
        return lifetime.compareTo(minLifetime) >= 0 && lifetime.compareTo(maxLifetime) <= 0;
    }

    /**
     * Defaults of the external contract: 60 s default, [10 s, 15 min] range,
     * revert retried after 1 s.
     */
    public static WatchdogPolicy defaults() {
        return new WatchdogPolicy(
                Duration.ofSeconds(60),
                Duration.ofSeconds(10),
                Duration.ofMinutes(15),
                Duration.ofSeconds(1)
        );
    }
}
