package com.questrail.microgrid.observability;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ComponentState;

import java.time.Instant;
import java.util.Optional;

/**
 * Record representing a lifecycle change of one component.
 *
 * @param trigger         what caused the change ("start", "hardware-report", ...)
 * @param pendingTarget   state the component is settling towards, or {@code null}
 */
public record ComponentTransitionEvent(
    Instant timestamp,
    ComponentId componentId,
    ComponentState oldState,
    ComponentState newState,
    String trigger,
    ComponentState pendingTarget
) {
    public boolean isStateChange() {
        return oldState != newState;
    }

    public Optional<ComponentState> pending() {
        return Optional.ofNullable(pendingTarget);
    }
}
