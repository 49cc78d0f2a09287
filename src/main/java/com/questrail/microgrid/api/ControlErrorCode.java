package com.questrail.microgrid.api;

/**
 * ControlErrorCode
 * -----------------------------------------------------------------------------
 * Failure taxonomy surfaced by {@link MicrogridControl}. Each code maps onto a
 * status code of the RPC layer.
 */
public enum ControlErrorCode
{
    /** Unknown component, or a component that is no longer reachable in inventory. */
    NOT_FOUND,

    /** Out-of-range lifetime, malformed bounds, unsupported metric. Rejected before any mutation. */
    INVALID_ARGUMENT,

    /** A state-machine guard was not met, e.g. stop requested while a battery still delivers power. */
    PRECONDITION_FAILED,

    /** The transition is not valid from the current lifecycle state. */
    INVALID_STATE,

    /** The underlying hardware call failed or timed out. May leave a partial transition. */
    DRIVER_ERROR,

    /** The driver reported the component as unreachable during the call. */
    UNAVAILABLE
}
