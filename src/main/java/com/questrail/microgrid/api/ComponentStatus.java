package com.questrail.microgrid.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view of a component's control-plane status.
 *
 * @param settlingTowards state an asynchronous transition is settling towards,
 *                        or {@code null} if the component is settled
 * @param reachable       {@code false} once the component was reported stale
 */
public record ComponentStatus(ComponentId id,
                              ComponentCategory category,
                              ComponentState state,
                              ComponentState settlingTowards,
                              boolean reachable)
{
    public ComponentStatus {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(state, "state");
    }

    public boolean inTransition() {
        return settlingTowards != null;
    }

    public Optional<ComponentState> pendingTarget() {
        return Optional.ofNullable(settlingTowards);
    }
}
