package com.questrail.microgrid.driver;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.PowerKind;

/**
 * ComponentDriver
 * =============================================================================
 * Narrow capability port through which the control plane reads from and
 * commands the physical components.
 *
 * <h2>Architectural Role</h2>
 * Implementations are <strong>pure hardware adapters</strong>. They MUST NOT:
 * <ul>
 *   <li>Track lifecycle state</li>
 *   <li>Floor setpoints or enforce lifetimes</li>
 *   <li>Retry on their own behalf</li>
 * </ul>
 *
 * <h2>Failure reporting</h2>
 * Every method may throw {@link DriverException}. A component that cannot be
 * reached at all is reported with {@link ComponentUnreachableException}.
 *
 * <h2>Threading</h2>
 * Calls for one component are serialized by the control plane; calls for
 * different components may arrive concurrently.
 */
public interface ComponentDriver
{
    /**
     * Capability flags of the component. Queried once when the component is
     * registered.
     */
    ComponentFeatures features(ComponentId id);

    /**
     * Current relay positions and power output.
     */
    HardwareState hardwareState(ComponentId id);

    /**
     * Open or close one of the component's relays.
     */
    void setRelay(ComponentId id, RelayKind relay, boolean closed);

    /**
     * Apply a power setpoint. The magnitude has already been floored to the
     * component's resolution.
     */
    void setPower(ComponentId id, PowerKind kind, double magnitude);

    /**
     * Begin the asynchronous precharge sequence. Completion is reported later
     * through {@link ComponentTelemetryListener#onHardwareState} with the DC
     * relay closed.
     */
    void beginPrecharge(ComponentId id);

    /**
     * Current error condition of the component.
     */
    ErrorState errorState(ComponentId id);

    /**
     * Acknowledge a recoverable error.
     */
    void ackError(ComponentId id);
}
