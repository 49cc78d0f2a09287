package com.questrail.microgrid.observability;

import com.questrail.microgrid.api.Bound;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.Metric;

import java.time.Instant;
import java.util.List;

/**
 * Events emitted by the bounds merger and by sample validation.
 */
public sealed interface BoundsEvent
        permits BoundsEvent.Updated, BoundsEvent.Expired, BoundsEvent.Violated
{
    Instant timestamp();

    ComponentId componentId();

    Metric metric();

    /** The merged inclusion set of a metric was replaced. */
    record Updated(Instant timestamp,
                   ComponentId componentId,
                   Metric metric,
                   List<Bound> merged,
                   Instant expiresAt) implements BoundsEvent {}

    /** A bound set reached its expiry and was removed. */
    record Expired(Instant timestamp,
                   ComponentId componentId,
                   Metric metric) implements BoundsEvent {}

    /** A measured sample fell outside every active bound. */
    record Violated(Instant timestamp,
                    ComponentId componentId,
                    Metric metric,
                    double value,
                    List<Bound> active) implements BoundsEvent {}
}
