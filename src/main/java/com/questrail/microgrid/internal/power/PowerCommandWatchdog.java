package com.questrail.microgrid.internal.power;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.PowerKind;
import com.questrail.microgrid.config.WatchdogPolicy;
import com.questrail.microgrid.driver.ComponentDriver;
import com.questrail.microgrid.driver.ComponentUnreachableException;
import com.questrail.microgrid.driver.DriverException;
import com.questrail.microgrid.internal.exec.ComponentLocks;
import com.questrail.microgrid.internal.state.ComponentRecord;
import com.questrail.microgrid.internal.state.ComponentRegistry;
import com.questrail.microgrid.internal.time.Cancellable;
import com.questrail.microgrid.internal.time.MonotonicClock;
import com.questrail.microgrid.internal.time.MonotonicScheduler;
import com.questrail.microgrid.internal.time.WallClock;
import com.questrail.microgrid.observability.ControlErrorEvent;
import com.questrail.microgrid.observability.MicrogridObservabilitySink;
import com.questrail.microgrid.observability.PowerCommandEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * PowerCommandWatchdog
 * =============================================================================
 * Holds the live power setpoint per (component, power kind) and drives it back
 * to zero when it is not refreshed in time.
 *
 * <h2>Anchoring constraints</h2>
 * <ul>
 *   <li>All deadlines use monotonic time. Wall-clock is only used for the
 *       {@code validUntil} returned to callers.</li>
 *   <li>A revert never runs before its deadline. If the scheduler dispatches
 *       early, the revert re-arms itself for the remaining time.</li>
 *   <li>Timer callbacks take the component's lock before touching anything, so
 *       a refresh and a revert cannot interleave.</li>
 *   <li>A stale revert (armed for an older generation) does nothing.</li>
 * </ul>
 *
 * <h2>Failure handling</h2>
 * A failed setpoint leaves the previous command installed and its revert armed.
 * A failed revert is reported to the observability sink and retried after
 * {@link WatchdogPolicy#revertRetryDelay()} until it succeeds or the command
 * is superseded.
 */
public final class PowerCommandWatchdog
{
    private static final Logger log = LoggerFactory.getLogger(PowerCommandWatchdog.class);

    private static final double FLOOR_EPSILON = 1e-9;

    private record Key(ComponentId componentId, PowerKind kind) {}

    /** Mutated only under the component's lock. */
    private static final class Slot {
        final PowerCommand command;
        Cancellable revert;

        Slot(PowerCommand command) {
            this.command = command;
        }
    }

    private final Map<Key, Slot> slots = new ConcurrentHashMap<>();
    private final Map<Key, Double> lastObserved = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();
    private volatile boolean shutdown;

    private final ComponentDriver driver;
    private final ComponentRegistry registry;
    private final ComponentLocks locks;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final WatchdogPolicy policy;
    private final MicrogridObservabilitySink sink;

    public PowerCommandWatchdog(ComponentDriver driver,
                                ComponentRegistry registry,
                                ComponentLocks locks,
                                MonotonicClock clock,
                                WallClock wallClock,
                                MonotonicScheduler scheduler,
                                WatchdogPolicy policy,
                                MicrogridObservabilitySink sink)
    {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Applies a setpoint and (re)arms its revert.
     *
     * @param lifetime how long the setpoint holds without refresh; {@code null}
     *                 selects {@link WatchdogPolicy#defaultLifetime()}
     * @return the instant after which the setpoint reverts to zero
     * @throws ControlException {@code NOT_FOUND}, {@code INVALID_ARGUMENT} for a
     *         lifetime out of range or a non-finite magnitude, {@code DRIVER_ERROR}
     *         or {@code UNAVAILABLE} if the driver rejects the setpoint
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public Instant setPower(ComponentId id, PowerKind kind, double magnitude, Duration lifetime)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");

        Duration effective = validateRequest(id, magnitude, lifetime);
        registry.requireKnown(id);

        return locks.call(id, () -> {
            if (shutdown) {
                throw new IllegalStateException("watchdog is shut down");
            }
            ComponentRecord record = registry.require(id);
            double applied = floorToResolution(magnitude, record.features().resolution(kind));

            try {
                driver.setPower(id, kind, applied);
            } catch (DriverException e) {
                throw translate(id, kind, e);
            }

            Key key = new Key(id, kind);
            Slot previous = slots.remove(key);
            if (previous != null && previous.revert != null) {
                previous.revert.cancel();
            }

            long deadline = clock.nowNanos() + effective.toNanos();
            Instant validUntil = wallClock.now().plus(effective);
            PowerCommand command = new PowerCommand(id, kind, applied, deadline, validUntil,
                    generations.incrementAndGet());
            Slot slot = new Slot(command);
            slots.put(key, slot);
            arm(key, slot, deadline);

            log.debug("{} {} setpoint {} (requested {}) until {}", id, kind, applied, magnitude, validUntil);
            sink.onPowerCommand(new PowerCommandEvent.Installed(
                    wallClock.now(), id, kind, magnitude, applied, validUntil));
            return validUntil;
        });
    }

    /**
     * Checks a setpoint request without touching the component.
     *
     * @return the effective lifetime
     * @throws ControlException {@code INVALID_ARGUMENT} for a lifetime out of
     *         range or a non-finite magnitude
     */
    public Duration validateRequest(ComponentId id, double magnitude, Duration lifetime)
    {
        Duration effective = lifetime == null ? policy.defaultLifetime() : lifetime;
        if (!policy.accepts(effective)) {
            throw ControlException.invalidArgument(id, "lifetime " + effective + " outside ["
                    + policy.minLifetime() + ", " + policy.maxLifetime() + "]");
        }
        if (!Double.isFinite(magnitude)) {
            throw ControlException.invalidArgument(id, "power setpoint must be finite, got " + magnitude);
        }
        return effective;
    }

    /**
     * Drops the component's live commands without a driver call. Used once a
     * lifecycle plan has driven power output to zero.
     */
    public void clear(ComponentId id)
    {
        if (!registry.isKnown(id)) {
            return;
        }
        locks.run(id, () -> {
            for (PowerKind kind : PowerKind.values()) {
                Slot slot = slots.remove(new Key(id, kind));
                if (slot != null) {
                    cancel(slot);
                    log.debug("{} {} setpoint cleared", id, kind);
                }
            }
        });
    }

    public Optional<PowerCommand> activeCommand(ComponentId id, PowerKind kind)
    {
        Slot slot = slots.get(new Key(id, kind));
        return slot == null ? Optional.empty() : Optional.of(slot.command);
    }

    /**
     * Records a measured output. Informational; never gates a command.
     */
    public void observe(ComponentId id, PowerKind kind, double value)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        if (registry.isKnown(id)) {
            lastObserved.put(new Key(id, kind), value);
        }
    }

    public OptionalDouble lastObserved(ComponentId id, PowerKind kind)
    {
        Double value = lastObserved.get(new Key(id, kind));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * Cancels every pending revert. Further setpoints are refused.
     */
    public void shutdown()
    {
        shutdown = true;
        for (Key key : new ArrayList<>(slots.keySet())) {
            locks.run(key.componentId(), () -> {
                Slot slot = slots.remove(key);
                if (slot != null) {
                    cancel(slot);
                }
            });
        }
    }

    /**
     * Floors the absolute value to a multiple of {@code resolution}, keeping
     * the sign. The epsilon absorbs representation error so that exact
     * multiples such as 0.3 at resolution 0.1 are not pushed down a step.
     */
    static double floorToResolution(double magnitude, double resolution)
    {
        if (!(resolution > 0)) {
            throw new IllegalArgumentException("resolution must be > 0");
        }
        double steps = Math.floor(Math.abs(magnitude) / resolution + FLOOR_EPSILON);
        double floored = steps * resolution;
        if (floored == 0.0) {
            return 0.0;
        }
        return Math.copySign(floored, magnitude);
    }

    // ---------------------------------------------------------------------
    // Revert
    // ---------------------------------------------------------------------

    private void arm(Key key, Slot slot, long deadlineNanos)
    {
        long generation = slot.command.generation();
        slot.revert = scheduler.scheduleAtNanos(deadlineNanos, () -> onDeadline(key, generation));
    }

    private void onDeadline(Key key, long generation)
    {
        ComponentId id = key.componentId();
        locks.run(id, () -> {
            Slot slot = slots.get(key);
            if (slot == null || slot.command.generation() != generation || shutdown) {
                return;
            }
            PowerCommand command = slot.command;
            if (!command.isDue(clock.nowNanos())) {
                arm(key, slot, command.deadlineNanos());
                return;
            }

            try {
                driver.setPower(id, key.kind(), 0.0);
            } catch (DriverException e) {
                log.warn("Revert of {} {} to zero failed, retrying in {}", id, key.kind(), policy.revertRetryDelay(), e);
                sink.onError(new ControlErrorEvent(wallClock.now(), id,
                        "revert of " + key.kind() + " setpoint to zero failed", e));
                arm(key, slot, clock.nowNanos() + policy.revertRetryDelay().toNanos());
                return;
            }

            slots.remove(key);
            log.info("{} {} setpoint {} expired, reverted to zero", id, key.kind(), command.magnitude());
            sink.onPowerCommand(new PowerCommandEvent.Reverted(
                    wallClock.now(), id, key.kind(), command.magnitude()));
        });
    }

    private static void cancel(Slot slot)
    {
        if (slot.revert != null) {
            slot.revert.cancel();
            slot.revert = null;
        }
    }

    private ControlException translate(ComponentId id, PowerKind kind, DriverException e)
    {
        String step = "set-power-" + kind.name().toLowerCase(Locale.ROOT);
        if (e instanceof ComponentUnreachableException) {
            return ControlException.unavailable(id, step, id + " unreachable while applying " + kind + " setpoint", e);
        }
        return ControlException.driverError(id, step, kind + " setpoint rejected by " + id + ": " + e.getMessage(), e);
    }
}
