package com.questrail.microgrid.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a pending deadline (power revert, bounds sweep).
 *
 * <p>
 * Implemented by the JDK executor scheduler, the Netty wheel-timer scheduler
 * and the deterministic scheduler used in tests.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
