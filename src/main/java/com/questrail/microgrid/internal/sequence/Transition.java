package com.questrail.microgrid.internal.sequence;

import com.questrail.microgrid.api.ComponentState;

/**
 * Lifecycle transitions that are realized through an action plan.
 */
public enum Transition
{
    START(ComponentState.OPERATIONAL),
    STANDBY(ComponentState.STANDBY),
    STOP(ComponentState.STOPPED);

    private final ComponentState target;

    Transition(ComponentState target) {
        this.target = target;
    }

    public ComponentState target() {
        return target;
    }
}
