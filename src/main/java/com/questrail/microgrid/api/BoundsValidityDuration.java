package com.questrail.microgrid.api;

import java.time.Duration;

/**
 * How long a set of added bounds stays in effect. {@link #UNSPECIFIED} falls
 * back to five seconds.
 */
public enum BoundsValidityDuration
{
    UNSPECIFIED(Duration.ofSeconds(5)),
    FIVE_SECONDS(Duration.ofSeconds(5)),
    ONE_MINUTE(Duration.ofMinutes(1)),
    FIVE_MINUTES(Duration.ofMinutes(5)),
    FIFTEEN_MINUTES(Duration.ofMinutes(15));

    private final Duration duration;

    BoundsValidityDuration(Duration duration) {
        this.duration = duration;
    }

    public Duration duration() {
        return duration;
    }
}
