package com.questrail.microgrid.internal.power;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.PowerKind;

import java.time.Instant;
import java.util.Objects;

/**
 * A live power setpoint for one (component, power kind).
 *
 * @param magnitude      the applied value, already floored to the component's resolution
 * @param deadlineNanos  monotonic revert deadline
 * @param validUntil     wall-clock rendering of the deadline, as returned to callers
 * @param generation     install counter; a scheduled revert only acts on the
 *                       generation it was armed for
 */
public record PowerCommand(
        ComponentId componentId,
        PowerKind kind,
        double magnitude,
        long deadlineNanos,
        Instant validUntil,
        long generation
) {
    public PowerCommand {
        Objects.requireNonNull(componentId, "componentId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(validUntil, "validUntil");
    }

    public boolean isDue(long nowNanos) {
        return nowNanos - deadlineNanos >= 0;
    }
}
