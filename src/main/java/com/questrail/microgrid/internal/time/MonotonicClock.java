package com.questrail.microgrid.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every deadline the control plane enforces.
 *
 * <h2>Binding invariant</h2>
 * Power-command lifetimes and bounds validity MUST be measured against a
 * monotonic source. Wall-clock time ({@link WallClock}) is only used to render
 * the {@code valid_until} / expiry timestamps returned to callers.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
