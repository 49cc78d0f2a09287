package com.questrail.microgrid.observability;

/**
 * Receives control-plane observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on request threads and on the scheduler's dispatcher
 * thread; implementations must be thread-safe.</p>
 */
public interface MicrogridObservabilitySink {
    /**
     * Called when a component's lifecycle state or pending target changes.
     */
    void onStateTransition(ComponentTransitionEvent event);

    /**
     * Called when a power setpoint is installed or reverted.
     */
    void onPowerCommand(PowerCommandEvent event);

    /**
     * Called when bounds are merged, expire, or a sample violates them.
     */
    void onBoundsEvent(BoundsEvent event);

    /**
     * Called when an error or anomaly occurs.
     */
    void onError(ControlErrorEvent event);
}
