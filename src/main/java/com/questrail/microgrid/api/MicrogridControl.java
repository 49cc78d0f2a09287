package com.questrail.microgrid.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * MicrogridControl
 * =============================================================================
 * Operations that back the microgrid device-control RPCs, one method per RPC.
 *
 * <p>Every failure is reported as a {@link ControlException} whose
 * {@link ControlErrorCode} maps directly onto an RPC status. Validation
 * failures ({@code NOT_FOUND}, {@code INVALID_ARGUMENT}) are raised before any
 * state is touched or any driver is called.</p>
 *
 * <p>Implementations are safe for concurrent use. Calls for one component are
 * serialized; calls for different components proceed in parallel.</p>
 */
public interface MicrogridControl
{
    /**
     * Merges inclusion bounds into the active set of one metric.
     *
     * @param validity how long the merged set stays in effect; {@code null}
     *                 means {@link BoundsValidityDuration#UNSPECIFIED}
     * @return the expiry of the merged set
     */
    Instant addComponentBounds(ComponentId id,
                               Metric metric,
                               List<Bound> bounds,
                               BoundsValidityDuration validity);

    /**
     * Sets the active power setpoint in watts. Positive discharges, negative
     * charges. A non-zero setpoint on a component in standby starts it first.
     *
     * @param lifetime how long the setpoint holds without refresh; {@code null}
     *                 selects the default lifetime
     * @return the instant the setpoint reverts to zero unless refreshed
     */
    Instant setComponentPowerActive(ComponentId id, double watts, Duration lifetime);

    default Instant setComponentPowerActive(ComponentId id, double watts) {
        return setComponentPowerActive(id, watts, null);
    }

    /**
     * Sets the reactive power setpoint in VAr. Positive is inductive, negative
     * capacitive.
     */
    Instant setComponentPowerReactive(ComponentId id, double var, Duration lifetime);

    default Instant setComponentPowerReactive(ComponentId id, double var) {
        return setComponentPowerReactive(id, var, null);
    }

    void startComponent(ComponentId id);

    void putComponentInStandby(ComponentId id);

    void stopComponent(ComponentId id);

    void ackComponentError(ComponentId id);

    /**
     * Lifecycle state of a component, including any transition still settling.
     */
    ComponentStatus componentState(ComponentId id);

    /**
     * The live merged inclusion intervals of a metric.
     */
    List<Bound> activeBounds(ComponentId id, Metric metric);
}
