package com.questrail.microgrid.internal.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <h2>Why a wheel</h2>
 * <p>A microgrid session may hold one pending revert per (component, power kind)
 * and each refresh reschedules it. The wheel keeps insertion and cancellation
 * O(1) and dispatches every deadline from a single worker thread.</p>
 *
 * <h2>Precision</h2>
 * <p>Deadlines are rounded up to the next tick, so a task may run up to one
 * tick late. It never runs early.</p>
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty types do not escape this class; callers see {@link Cancellable}.</p>
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler, AutoCloseable {

    private final Timer timer;
    private final MonotonicClock clock;

    /**
     * Creates a scheduler that owns its own wheel timer.
     *
     * @param clock        monotonic clock used for delay calculations
     * @param tickMillis   wheel tick duration in milliseconds
     * @param threadFactory factory for the dispatcher thread
     */
    public HashedWheelTimerScheduler(MonotonicClock clock, long tickMillis, ThreadFactory threadFactory) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(threadFactory, "threadFactory");
        if (tickMillis <= 0) {
            throw new IllegalArgumentException("tickMillis must be > 0");
        }
        this.timer = new HashedWheelTimer(threadFactory, tickMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(t -> task.run(), delayNanos, TimeUnit.NANOSECONDS);
        return timeout::cancel;
    }

    /**
     * Stops the dispatcher thread; pending tasks are discarded.
     */
    @Override
    public void close() {
        timer.stop();
    }
}
