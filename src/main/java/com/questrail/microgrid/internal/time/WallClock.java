package com.questrail.microgrid.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * UTC clock used to stamp expiry timestamps and observability events.
 *
 * <p>
 * This clock may jump (NTP, manual setting). It MUST NOT be used to decide
 * whether a bound or a power command has expired.
 * </p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
