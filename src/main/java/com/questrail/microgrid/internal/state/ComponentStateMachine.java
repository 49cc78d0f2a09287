package com.questrail.microgrid.internal.state;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ComponentState;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.driver.ComponentDriver;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.ComponentUnreachableException;
import com.questrail.microgrid.driver.DriverException;
import com.questrail.microgrid.driver.ErrorState;
import com.questrail.microgrid.driver.HardwareState;
import com.questrail.microgrid.internal.exec.ComponentLocks;
import com.questrail.microgrid.internal.sequence.ActionPlan;
import com.questrail.microgrid.internal.sequence.ActionPlans;
import com.questrail.microgrid.internal.sequence.CommandSequencer;
import com.questrail.microgrid.internal.sequence.SequenceResult;
import com.questrail.microgrid.internal.sequence.Transition;
import com.questrail.microgrid.internal.time.WallClock;
import com.questrail.microgrid.observability.ComponentTransitionEvent;
import com.questrail.microgrid.observability.MicrogridObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * ComponentStateMachine
 * =============================================================================
 * Owns the lifecycle state of every component and validates and executes
 * transitions.
 *
 * <h2>Order of checks</h2>
 * <ol>
 *   <li>{@code NOT_FOUND}: unknown or unreachable component.</li>
 *   <li>No-op: already settled in the target state; no driver call at all.</li>
 *   <li>{@code INVALID_STATE}: transition not valid from the current state.</li>
 *   <li>{@code PRECONDITION_FAILED}: no plan for the category, or a plan guard
 *       failed. Raised before any driver command.</li>
 *   <li>{@code DRIVER_ERROR} / {@code UNAVAILABLE}: a command failed; the
 *       lifecycle state is unchanged and the hardware snapshot shows the last
 *       confirmed step.</li>
 * </ol>
 *
 * <h2>Asynchronous steps</h2>
 * If a plan ends with an asynchronous step still in flight (precharge), the
 * component keeps its state and records the transition as pending. A later
 * hardware report settles it.
 *
 * <h2>Threading</h2>
 * Every operation runs under the component's lock from {@link ComponentLocks}.
 */
public final class ComponentStateMachine
{
    private static final Logger log = LoggerFactory.getLogger(ComponentStateMachine.class);

    private final ComponentRegistry registry;
    private final ComponentLocks locks;
    private final CommandSequencer sequencer;
    private final ComponentDriver driver;
    private final WallClock wallClock;
    private final MicrogridObservabilitySink sink;
    private final Consumer<ComponentId> powerReset;

    /**
     * @param powerReset invoked under the component's lock after a plan that
     *                   leaves power output at zero
     */
    public ComponentStateMachine(ComponentRegistry registry,
                                 ComponentLocks locks,
                                 CommandSequencer sequencer,
                                 ComponentDriver driver,
                                 WallClock wallClock,
                                 MicrogridObservabilitySink sink,
                                 Consumer<ComponentId> powerReset) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.sequencer = Objects.requireNonNull(sequencer, "sequencer");
        this.driver = Objects.requireNonNull(driver, "driver");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.powerReset = Objects.requireNonNull(powerReset, "powerReset");
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public void start(ComponentId id) {
        registry.requireKnown(id);
        locks.run(id, () -> {
            ComponentRecord record = registry.require(id);
            if (record.isSettledIn(ComponentState.OPERATIONAL)) {
                log.debug("{} already operational", id);
                return;
            }
            if (record.state() == ComponentState.ERROR && readErrorState(id, "read-error-state") == ErrorState.FATAL) {
                throw ControlException.preconditionFailed(id, "read-error-state",
                        id + " reports a fatal error and cannot be started");
            }
            runPlan(record, Transition.START, "start");
        });
    }

    public void standby(ComponentId id) {
        registry.requireKnown(id);
        locks.run(id, () -> {
            ComponentRecord record = registry.require(id);
            if (record.isSettledIn(ComponentState.STANDBY)) {
                log.debug("{} already in standby", id);
                return;
            }
            if (record.state() == ComponentState.STOPPED || record.state() == ComponentState.ERROR) {
                throw ControlException.invalidState(id,
                        "cannot put " + id + " in standby from " + record.state());
            }
            runPlan(record, Transition.STANDBY, "standby");
        });
    }

    public void stop(ComponentId id) {
        registry.requireKnown(id);
        locks.run(id, () -> {
            ComponentRecord record = registry.require(id);
            if (record.isSettledIn(ComponentState.STOPPED)) {
                log.debug("{} already stopped", id);
                return;
            }
            runPlan(record, Transition.STOP, "stop");
        });
    }

    public void ackError(ComponentId id) {
        registry.requireKnown(id);
        locks.run(id, () -> {
            ComponentRecord record = registry.require(id);
            if (record.state() != ComponentState.ERROR) {
                throw ControlException.invalidState(id,
                        id + " is " + record.state() + ", not in error");
            }

            ErrorState errorState = readErrorState(id, "read-error-state");
            if (errorState == ErrorState.FATAL) {
                throw ControlException.preconditionFailed(id, "read-error-state",
                        id + " reports a fatal error that cannot be acknowledged");
            }
            if (errorState == ErrorState.RECOVERABLE) {
                try {
                    driver.ackError(id);
                } catch (DriverException e) {
                    throw translate(id, "ack-error", e);
                }
            }

            ComponentState target = ActionPlans.recoveryState(record.category());
            commit(record, registry.require(id).withState(target, wallClock.now()), "ack-error");
        });
    }

    // ---------------------------------------------------------------------
    // Inventory and asynchronous reports
    // ---------------------------------------------------------------------

    public ComponentRecord register(ComponentId id, ComponentCategory category) {
        Objects.requireNonNull(id, "id");
        ComponentFeatures features;
        try {
            features = Objects.requireNonNull(driver.features(id), "features");
        } catch (DriverException e) {
            throw translate(id, "read-features", e);
        }
        return locks.call(id, () -> {
            ComponentRecord record = registry.register(id, category, features, wallClock.now());
            log.info("Registered {} as {} with {}", id, category, record.features());
            return record;
        });
    }

    public void markUnreachable(ComponentId id) {
        if (!registry.isKnown(id)) {
            return;
        }
        locks.run(id, () -> registry.find(id).ifPresent(record -> {
            if (record.reachable()) {
                log.warn("{} is unreachable", id);
                registry.put(record.withReachable(false, wallClock.now()));
            }
        }));
    }

    /**
     * Applies a hardware report: refreshes the last-known substates and
     * settles a pending transition whose asynchronous steps have completed.
     */
    public void onHardwareState(ComponentId id, HardwareState hardware) {
        Objects.requireNonNull(hardware, "hardware");
        if (!registry.isKnown(id)) {
            log.debug("Ignoring hardware report for unknown {}", id);
            return;
        }
        locks.run(id, () -> {
            ComponentRecord record = registry.find(id).orElseThrow();

            ComponentRecord updated = record.withHardware(hardware);
            if (!record.reachable()) {
                updated = updated.withReachable(true, wallClock.now());
            }

            Transition pending = record.pending().orElse(null);
            if (pending != null) {
                ActionPlan plan = ActionPlans.lookup(record.category(), pending).orElse(null);
                if (plan == null || plan.isSettled(hardware, record.features())) {
                    commit(record, updated.withState(pending.target(), wallClock.now()), "hardware-report");
                    return;
                }
            }
            registry.put(updated);
        });
    }

    /**
     * Moves the component to {@link ComponentState#ERROR} when its hardware
     * reports an error. Clearing is explicit through {@link #ackError}.
     */
    public void onErrorReported(ComponentId id, ErrorState errorState) {
        Objects.requireNonNull(errorState, "errorState");
        if (errorState == ErrorState.NONE || !registry.isKnown(id)) {
            return;
        }
        locks.run(id, () -> registry.find(id).ifPresent(record -> {
            if (record.isSettledIn(ComponentState.ERROR)) {
                return;
            }
            commit(record, record.withState(ComponentState.ERROR, wallClock.now()), "error-report:" + errorState);
        }));
    }

    /**
     * Runs the Start plan if the component is settled in standby. A non-zero
     * active setpoint wakes a component this way. Any other state is left to
     * the driver.
     *
     * @return whether the Start plan ran
     */
    public boolean resumeFromStandby(ComponentId id) {
        registry.requireKnown(id);
        return locks.call(id, () -> {
            ComponentRecord record = registry.require(id);
            if (!record.isSettledIn(ComponentState.STANDBY)) {
                return false;
            }
            log.info("{} leaves standby for an active setpoint", id);
            runPlan(record, Transition.START, "set-power-active");
            return true;
        });
    }

    public ComponentRecord record(ComponentId id) {
        return registry.find(id)
                .orElseThrow(() -> ControlException.notFound(id, "unknown component " + id));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void runPlan(ComponentRecord record, Transition transition, String trigger) {
        ComponentId id = record.id();
        ActionPlan plan = ActionPlans.lookup(record.category(), transition)
                .orElseThrow(() -> ControlException.preconditionFailed(id, null,
                        record.category() + " components do not support " + trigger));

        SequenceResult result;
        try {
            result = sequencer.execute(id, record.features(), plan,
                    hw -> registry.find(id).ifPresent(r -> registry.put(r.withHardware(hw))));
        } catch (ControlException e) {
            if (e.getCause() instanceof ComponentUnreachableException) {
                markUnreachable(id);
            }
            throw e;
        }

        log.debug("{}: {} executed {} skipped {}", id, plan.name(), result.executed(), result.skipped());

        ComponentRecord current = registry.require(id);
        ComponentRecord next = result.settled()
                ? current.withState(transition.target(), wallClock.now())
                : current.withPending(transition, wallClock.now());
        commit(record, next, trigger);

        if (plan.resetsPower() && result.powerAtZero()) {
            powerReset.accept(id);
        }
    }

    private void commit(ComponentRecord before, ComponentRecord after, String trigger) {
        registry.put(after);
        sink.onStateTransition(new ComponentTransitionEvent(
                wallClock.now(),
                after.id(),
                before.state(),
                after.state(),
                trigger,
                after.pending().map(Transition::target).orElse(null)));
    }

    private ErrorState readErrorState(ComponentId id, String step) {
        try {
            return Objects.requireNonNull(driver.errorState(id), "errorState");
        } catch (DriverException e) {
            throw translate(id, step, e);
        }
    }

    private ControlException translate(ComponentId id, String step, DriverException e) {
        if (e instanceof ComponentUnreachableException) {
            markUnreachable(id);
            return ControlException.unavailable(id, step, id + " unreachable during " + step, e);
        }
        return ControlException.driverError(id, step, "step " + step + " failed on " + id + ": " + e.getMessage(), e);
    }
}
