package com.questrail.microgrid.observability;

import com.questrail.microgrid.api.ComponentId;

import java.time.Instant;

/**
 * Record representing an error in the control plane that has no caller to
 * surface to (timer-driven reverts, asynchronous reports) or that was rejected
 * back to a caller.
 */
public record ControlErrorEvent(
    Instant timestamp,
    ComponentId componentId,
    String message,
    Throwable cause
) {
}
