package com.questrail.microgrid.internal.state;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ComponentState;
import com.questrail.microgrid.api.ComponentStatus;
import com.questrail.microgrid.driver.ComponentFeatures;
import com.questrail.microgrid.driver.HardwareState;
import com.questrail.microgrid.internal.sequence.Transition;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ComponentRecord
 * -----------------------------------------------------------------------------
 * Immutable per-component state held by the control plane.
 *
 * <h2>Intent</h2>
 * Captures everything the state machine needs to know about one component:
 * identity, category, features, lifecycle state, last confirmed hardware
 * substates, and an optional transition that is still settling.
 *
 * It contains no behavior; transitions are driven by
 * {@link ComponentStateMachine} under the component's lock.
 */
public final class ComponentRecord
{
    private final ComponentId id;
    private final ComponentCategory category;
    private final ComponentFeatures features;
    private final ComponentState state;
    private final HardwareState hardware;
    private final Transition pending;
    private final boolean reachable;
    private final Instant lastChange;

    private ComponentRecord(ComponentId id,
                            ComponentCategory category,
                            ComponentFeatures features,
                            ComponentState state,
                            HardwareState hardware,
                            Transition pending,
                            boolean reachable,
                            Instant lastChange) {
        this.id = Objects.requireNonNull(id, "id");
        this.category = Objects.requireNonNull(category, "category");
        this.features = Objects.requireNonNull(features, "features");
        this.state = Objects.requireNonNull(state, "state");
        this.hardware = Objects.requireNonNull(hardware, "hardware");
        this.pending = pending;
        this.reachable = reachable;
        this.lastChange = Objects.requireNonNull(lastChange, "lastChange");
    }

    public ComponentId id() {
        return id;
    }

    public ComponentCategory category() {
        return category;
    }

    public ComponentFeatures features() {
        return features;
    }

    public ComponentState state() {
        return state;
    }

    public HardwareState hardware() {
        return hardware;
    }

    public Optional<Transition> pending() {
        return Optional.ofNullable(pending);
    }

    public boolean reachable() {
        return reachable;
    }

    public Instant lastChange() {
        return lastChange;
    }

    /**
     * Settled in {@code target} with nothing in flight.
     */
    public boolean isSettledIn(ComponentState target) {
        return state == target && pending == null;
    }

    public ComponentStatus toStatus() {
        return new ComponentStatus(id, category, state,
                pending != null ? pending.target() : null,
                reachable);
    }

    // ---------------------------------------------------------------------
    // Factory helpers
    // ---------------------------------------------------------------------

    /**
     * State of a component on discovery.
     */
    public static ComponentRecord discovered(ComponentId id,
                                             ComponentCategory category,
                                             ComponentFeatures features,
                                             Instant now) {
        return new ComponentRecord(id, category, features,
                ComponentState.UNKNOWN, HardwareState.unknown(), null, true, now);
    }

    // ---------------------------------------------------------------------
    // State transition helpers
    // ---------------------------------------------------------------------

    public ComponentRecord withState(ComponentState newState, Instant now) {
        return new ComponentRecord(id, category, features, newState, hardware, null, reachable, now);
    }

    public ComponentRecord withPending(Transition transition, Instant now) {
        return new ComponentRecord(id, category, features, state, hardware, transition, reachable, now);
    }

    public ComponentRecord withHardware(HardwareState newHardware) {
        return new ComponentRecord(id, category, features, state, newHardware, pending, reachable, lastChange);
    }

    public ComponentRecord withReachable(boolean isReachable, Instant now) {
        return new ComponentRecord(id, category, features, state, hardware, pending, isReachable, now);
    }

    public ComponentRecord withFeatures(ComponentFeatures newFeatures) {
        return new ComponentRecord(id, category, newFeatures, state, hardware, pending, reachable, lastChange);
    }
}
