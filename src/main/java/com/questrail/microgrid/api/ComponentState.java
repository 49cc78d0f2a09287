package com.questrail.microgrid.api;

/**
 * ComponentState
 * -----------------------------------------------------------------------------
 * Lifecycle state of a component as tracked by the control plane.
 *
 * <h2>Transitions</h2>
 * <ul>
 *   <li>{@link #STOPPED}, {@link #STANDBY}, {@link #ERROR} → {@link #OPERATIONAL} via start</li>
 *   <li>{@link #OPERATIONAL} → {@link #STANDBY} via standby</li>
 *   <li>{@link #OPERATIONAL}, {@link #STANDBY}, {@link #ERROR} → {@link #STOPPED} via stop</li>
 *   <li>{@link #ERROR} → {@link #STOPPED} or {@link #STANDBY} via error acknowledgement</li>
 * </ul>
 *
 * There is no terminal state. {@link #UNKNOWN} is the state of a freshly
 * discovered component whose hardware has not been driven yet.
 */
public enum ComponentState
{
    UNKNOWN,
    STOPPED,
    STANDBY,
    OPERATIONAL,
    ERROR
}
