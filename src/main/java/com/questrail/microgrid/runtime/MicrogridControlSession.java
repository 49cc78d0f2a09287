package com.questrail.microgrid.runtime;

import com.questrail.microgrid.api.Bound;
import com.questrail.microgrid.api.BoundsValidityDuration;
import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ComponentStatus;
import com.questrail.microgrid.api.ControlErrorCode;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.Metric;
import com.questrail.microgrid.api.MicrogridControl;
import com.questrail.microgrid.api.PowerKind;
import com.questrail.microgrid.config.MicrogridRuntimeConfig;
import com.questrail.microgrid.driver.ComponentDriver;
import com.questrail.microgrid.driver.ComponentTelemetryListener;
import com.questrail.microgrid.driver.ErrorState;
import com.questrail.microgrid.driver.HardwareState;
import com.questrail.microgrid.internal.bounds.BoundsMerger;
import com.questrail.microgrid.internal.exec.ComponentLocks;
import com.questrail.microgrid.internal.power.PowerCommand;
import com.questrail.microgrid.internal.power.PowerCommandWatchdog;
import com.questrail.microgrid.internal.sequence.CommandSequencer;
import com.questrail.microgrid.internal.state.ComponentRegistry;
import com.questrail.microgrid.internal.state.ComponentStateMachine;
import com.questrail.microgrid.internal.time.Cancellable;
import com.questrail.microgrid.internal.time.HashedWheelTimerScheduler;
import com.questrail.microgrid.internal.time.MonotonicClock;
import com.questrail.microgrid.internal.time.MonotonicScheduler;
import com.questrail.microgrid.internal.time.SystemMonotonicClock;
import com.questrail.microgrid.internal.time.SystemWallClock;
import com.questrail.microgrid.internal.time.WallClock;
import com.questrail.microgrid.observability.BoundsEvent;
import com.questrail.microgrid.observability.ControlErrorEvent;
import com.questrail.microgrid.observability.MicrogridObservabilitySink;
import com.questrail.microgrid.observability.NullObservabilitySink;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MicrogridControlSession
 * =============================================================================
 * Composition root and lifecycle owner for one running microgrid session.
 *
 * <h2>Ownership</h2>
 * The session owns exactly one {@link ComponentStateMachine}, one
 * {@link BoundsMerger} and one {@link PowerCommandWatchdog}. All three share a
 * single {@link ComponentRegistry} and a single set of per-component locks.
 *
 * <h2>Inbound seams</h2>
 * <ul>
 *   <li>{@link MicrogridControl}: the RPC layer.</li>
 *   <li>{@link ComponentTelemetryListener}: driver reports.</li>
 *   <li>{@link #registerComponent} / {@link #markUnreachable}: the external
 *       inventory.</li>
 * </ul>
 *
 * <h2>Teardown</h2>
 * {@link #close()} cancels the bounds sweep and every pending revert, then
 * stops the scheduler if the session created it.
 */
public final class MicrogridControlSession
        implements MicrogridControl, ComponentTelemetryListener, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(MicrogridControlSession.class);

    private final ComponentStateMachine stateMachine;
    private final BoundsMerger bounds;
    private final PowerCommandWatchdog watchdog;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final AutoCloseable ownedScheduler;
    private final MicrogridObservabilitySink sink;
    private final Duration sweepInterval;

    private final Object sweepLock = new Object();
    private Cancellable sweepTask;
    private volatile boolean closed;

    private MicrogridControlSession(Builder b, MonotonicScheduler scheduler, AutoCloseable ownedScheduler) {
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.scheduler = scheduler;
        this.ownedScheduler = ownedScheduler;
        this.sink = b.observabilitySink;
        this.sweepInterval = b.config.boundsPolicy().sweepInterval();

        ComponentRegistry registry = new ComponentRegistry();
        ComponentLocks locks = new ComponentLocks();

        this.watchdog = new PowerCommandWatchdog(
                b.driver, registry, locks, clock, wallClock, scheduler, b.config.watchdogPolicy(), sink);
        this.bounds = new BoundsMerger(registry, locks, clock, wallClock, sink);
        this.stateMachine = new ComponentStateMachine(
                registry, locks, new CommandSequencer(b.driver), b.driver, wallClock, sink, watchdog::clear);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    private void open(Map<ComponentId, ComponentCategory> inventory) {
        for (Map.Entry<ComponentId, ComponentCategory> entry : inventory.entrySet()) {
            try {
                registerComponent(entry.getKey(), entry.getValue());
            } catch (ControlException e) {
                // The component stays unknown until the inventory registers it again.
                log.warn("Initial registration of {} failed: {}", entry.getKey(), e.getMessage());
            }
        }
        scheduleSweep();
        log.info("Microgrid session open with {} components", inventory.size());
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        synchronized (sweepLock) {
            if (sweepTask != null) {
                sweepTask.cancel();
                sweepTask = null;
            }
        }
        watchdog.shutdown();
        if (ownedScheduler != null) {
            try {
                ownedScheduler.close();
            } catch (Exception e) {
                log.warn("Failed to stop session scheduler", e);
                sink.onError(new ControlErrorEvent(wallClock.now(), null, "scheduler shutdown failed", e));
            }
        }
        log.info("Microgrid session closed");
    }

    // ---------------------------------------------------------------------
    // Inventory
    // ---------------------------------------------------------------------

    /**
     * Registers a component discovered by the external inventory, or refreshes
     * a known one and marks it reachable again.
     */
    public void registerComponent(ComponentId id, ComponentCategory category) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        guarded(id, () -> stateMachine.register(id, category));
    }

    /**
     * Flags a component as stale. Commands for it fail with {@code NOT_FOUND}
     * until a hardware report or a fresh registration revives it.
     */
    public void markUnreachable(ComponentId id) {
        stateMachine.markUnreachable(Objects.requireNonNull(id, "id"));
    }

    // ---------------------------------------------------------------------
    // MicrogridControl
    // ---------------------------------------------------------------------

    @Override
    public Instant addComponentBounds(ComponentId id,
                                      Metric metric,
                                      List<Bound> bounds,
                                      BoundsValidityDuration validity) {
        requireId(id);
        return guarded(id, () -> this.bounds.addBounds(id, metric, bounds, validity));
    }

    @Override
    public Instant setComponentPowerActive(ComponentId id, double watts, Duration lifetime) {
        return setPower(id, PowerKind.ACTIVE, watts, lifetime);
    }

    @Override
    public Instant setComponentPowerReactive(ComponentId id, double var, Duration lifetime) {
        return setPower(id, PowerKind.REACTIVE, var, lifetime);
    }

    @Override
    public void startComponent(ComponentId id) {
        requireId(id);
        guardedRun(id, () -> stateMachine.start(id));
    }

    @Override
    public void putComponentInStandby(ComponentId id) {
        requireId(id);
        guardedRun(id, () -> stateMachine.standby(id));
    }

    @Override
    public void stopComponent(ComponentId id) {
        requireId(id);
        guardedRun(id, () -> stateMachine.stop(id));
    }

    @Override
    public void ackComponentError(ComponentId id) {
        requireId(id);
        guardedRun(id, () -> stateMachine.ackError(id));
    }

    @Override
    public ComponentStatus componentState(ComponentId id) {
        requireId(id);
        return stateMachine.record(id).toStatus();
    }

    @Override
    public List<Bound> activeBounds(ComponentId id, Metric metric) {
        requireId(id);
        stateMachine.record(id);
        return bounds.activeBounds(id, metric);
    }

    /**
     * The live setpoint of one power kind, if any.
     */
    public Optional<PowerCommand> activePowerCommand(ComponentId id, PowerKind kind) {
        requireId(id);
        return watchdog.activeCommand(id, Objects.requireNonNull(kind, "kind"));
    }

    // ---------------------------------------------------------------------
    // ComponentTelemetryListener
    // ---------------------------------------------------------------------

    @Override
    public void onHardwareState(ComponentId id, HardwareState state) {
        requireId(id);
        stateMachine.onHardwareState(id, state);
        for (PowerKind kind : PowerKind.values()) {
            watchdog.observe(id, kind, state.power(kind));
        }
    }

    @Override
    public boolean onMetricSample(ComponentId id, Metric metric, double value) {
        requireId(id);
        Objects.requireNonNull(metric, "metric");

        metric.powerKind().ifPresent(kind -> watchdog.observe(id, kind, value));

        boolean inBounds = bounds.validate(id, metric, value);
        if (!inBounds) {
            List<Bound> active = bounds.activeBounds(id, metric);
            if (!active.isEmpty()) {
                log.debug("{} {} sample {} outside {}", id, metric, value, active);
                sink.onBoundsEvent(new BoundsEvent.Violated(wallClock.now(), id, metric, value, active));
            }
        }
        return inBounds;
    }

    @Override
    public void onErrorReported(ComponentId id, ErrorState errorState) {
        requireId(id);
        stateMachine.onErrorReported(id, errorState);
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /**
     * A non-zero active setpoint first brings a component out of standby.
     * The request is validated before the Start plan can touch any relay.
     */
    private Instant setPower(ComponentId id, PowerKind kind, double value, Duration lifetime) {
        requireId(id);
        return guarded(id, () -> {
            watchdog.validateRequest(id, value, lifetime);
            if (kind == PowerKind.ACTIVE && value != 0.0) {
                stateMachine.resumeFromStandby(id);
            }
            return watchdog.setPower(id, kind, value, lifetime);
        });
    }

    /**
     * Runs a control operation, reporting rejections to the sink. An
     * {@code UNAVAILABLE} outcome also flags the component as stale.
     */
    private <T> T guarded(ComponentId id, Supplier<T> operation) {
        ensureOpen();
        try {
            return operation.get();
        } catch (ControlException e) {
            if (e.code() == ControlErrorCode.UNAVAILABLE) {
                stateMachine.markUnreachable(id);
            }
            sink.onError(new ControlErrorEvent(wallClock.now(), id, e.code() + ": " + e.getMessage(), e));
            throw e;
        }
    }

    private void guardedRun(ComponentId id, Runnable operation) {
        guarded(id, () -> {
            operation.run();
            return null;
        });
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("session is closed");
        }
    }

    private static void requireId(ComponentId id) {
        if (id == null) {
            throw ControlException.invalidArgument("component id must be given");
        }
    }

    private void scheduleSweep() {
        synchronized (sweepLock) {
            if (closed) {
                return;
            }
            sweepTask = scheduler.scheduleAfter(sweepInterval, clock, this::runSweep);
        }
    }

    private void runSweep() {
        if (closed) {
            return;
        }
        try {
            int removed = bounds.sweep();
            if (removed > 0) {
                log.debug("Bounds sweep removed {} expired sets", removed);
            }
        } catch (RuntimeException e) {
            log.error("Bounds sweep failed", e);
            sink.onError(new ControlErrorEvent(wallClock.now(), null, "bounds sweep failed", e));
        }
        scheduleSweep();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private static final long DEFAULT_TICK_MILLIS = 10;

        private ComponentDriver driver;
        private MicrogridRuntimeConfig config = MicrogridRuntimeConfig.builder().build();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private MicrogridObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withDriver(ComponentDriver driver) {
            this.driver = driver;
            return this;
        }

        public Builder withConfig(MicrogridRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        /**
         * Supplies the scheduler for reverts and the bounds sweep. Without one,
         * the session creates and owns a {@link HashedWheelTimerScheduler}.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(MicrogridObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Builds the session, registers the configured inventory and starts
         * the bounds sweep.
         */
        public MicrogridControlSession build() {
            Objects.requireNonNull(driver, "driver");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            MonotonicScheduler effective = scheduler;
            AutoCloseable owned = null;
            if (effective == null) {
                HashedWheelTimerScheduler wheel = new HashedWheelTimerScheduler(
                        clock, DEFAULT_TICK_MILLIS, new DefaultThreadFactory("microgrid-watchdog", true));
                effective = wheel;
                owned = wheel;
            }

            MicrogridControlSession session = new MicrogridControlSession(this, effective, owned);
            session.open(config.inventory());
            return session;
        }
    }
}
