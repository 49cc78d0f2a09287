package com.questrail.microgrid.observability;

import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.PowerKind;

import java.time.Instant;

/**
 * Events emitted by the power command watchdog.
 */
public sealed interface PowerCommandEvent
        permits PowerCommandEvent.Installed, PowerCommandEvent.Reverted
{
    Instant timestamp();

    ComponentId componentId();

    PowerKind kind();

    /** A setpoint was applied and its revert deadline armed. */
    record Installed(Instant timestamp,
                     ComponentId componentId,
                     PowerKind kind,
                     double requested,
                     double applied,
                     Instant validUntil) implements PowerCommandEvent {}

    /** A setpoint expired without refresh and was driven back to zero. */
    record Reverted(Instant timestamp,
                    ComponentId componentId,
                    PowerKind kind,
                    double previous) implements PowerCommandEvent {}
}
