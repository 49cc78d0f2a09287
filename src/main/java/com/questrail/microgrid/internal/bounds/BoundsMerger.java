package com.questrail.microgrid.internal.bounds;

import com.questrail.microgrid.api.Bound;
import com.questrail.microgrid.api.BoundsValidityDuration;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.api.Metric;
import com.questrail.microgrid.internal.exec.ComponentLocks;
import com.questrail.microgrid.internal.state.ComponentRecord;
import com.questrail.microgrid.internal.state.ComponentRegistry;
import com.questrail.microgrid.internal.time.MonotonicClock;
import com.questrail.microgrid.internal.time.WallClock;
import com.questrail.microgrid.observability.BoundsEvent;
import com.questrail.microgrid.observability.MicrogridObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * BoundsMerger
 * =============================================================================
 * Owns the inclusion bound sets of every (component, metric) pair.
 *
 * <h2>Adding bounds</h2>
 * New intervals are merged with the live (non-expired) intervals of the metric.
 * The resulting set replaces the old one and carries the expiry of the latest
 * submission, so {@code add(A); add(B)} yields the same intervals as
 * {@code add(A ∪ B)}.
 *
 * <h2>Expiry</h2>
 * A set is in effect for any check before its deadline and gone at or after
 * it. Expired sets are dropped lazily whenever they are read and proactively
 * by {@link #sweep()}.
 *
 * <h2>Power metrics</h2>
 * A value of exactly zero on a power metric always validates, whatever the
 * configured set, even when there is none.
 *
 * <h2>Threading</h2>
 * Every read-modify-write runs under the component's lock.
 */
public final class BoundsMerger
{
    private static final Logger log = LoggerFactory.getLogger(BoundsMerger.class);

    private record Key(ComponentId componentId, Metric metric) {}

    private final ConcurrentMap<Key, BoundSet> sets = new ConcurrentHashMap<>();

    private final ComponentRegistry registry;
    private final ComponentLocks locks;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MicrogridObservabilitySink sink;

    public BoundsMerger(ComponentRegistry registry,
                        ComponentLocks locks,
                        MonotonicClock clock,
                        WallClock wallClock,
                        MicrogridObservabilitySink sink) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Merges {@code bounds} into the metric's live set.
     *
     * @param validity how long the merged set stays in effect; {@code null}
     *                 means {@link BoundsValidityDuration#UNSPECIFIED}
     * @return the expiry of the merged set; for an empty {@code bounds} list the
     *         expiry of the current live set, or now if there is none
     * @throws ControlException {@code NOT_FOUND} for an unknown component,
     *         {@code INVALID_ARGUMENT} for an unsupported metric
     */
    public Instant addBounds(ComponentId id,
                             Metric metric,
                             List<Bound> bounds,
                             BoundsValidityDuration validity) {
        Objects.requireNonNull(id, "id");
        if (metric == null) {
            throw ControlException.invalidArgument(id, "metric must be given");
        }
        if (bounds == null) {
            throw ControlException.invalidArgument(id, "bounds must be given");
        }
        List<Bound> submitted = new ArrayList<>(bounds.size());
        for (Bound b : bounds) {
            if (b == null) {
                throw ControlException.invalidArgument(id, "bounds must not contain null");
            }
            submitted.add(b);
        }
        Duration duration = (validity == null ? BoundsValidityDuration.UNSPECIFIED : validity).duration();

        registry.requireKnown(id);
        return locks.call(id, () -> {
            ComponentRecord record = registry.require(id);
            if (!record.features().supportsMetric(metric)) {
                throw ControlException.invalidArgument(id, id + " does not support metric " + metric);
            }

            Key key = new Key(id, metric);
            BoundSet live = liveSet(key);

            if (submitted.isEmpty()) {
                return live != null ? live.expiresAt() : wallClock.now();
            }

            long expiryNanos = clock.nowNanos() + duration.toNanos();
            Instant expiresAt = wallClock.now().plus(duration);

            BoundSet merged = live != null
                    ? live.mergedWith(submitted, expiryNanos, expiresAt)
                    : BoundSet.of(submitted, expiryNanos, expiresAt);
            sets.put(key, merged);

            log.debug("{} {} bounds now {}", id, metric, merged);
            sink.onBoundsEvent(new BoundsEvent.Updated(wallClock.now(), id, metric, merged.intervals(), expiresAt));
            return expiresAt;
        });
    }

    /**
     * Whether {@code value} lies within any live interval of the metric.
     * Zero on a power metric is always within range.
     */
    public boolean validate(ComponentId id, Metric metric, double value) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metric, "metric");

        if (metric.isPowerMetric() && value == 0.0) {
            return true;
        }
        if (!registry.isKnown(id)) {
            return false;
        }
        return locks.call(id, () -> {
            BoundSet live = liveSet(new Key(id, metric));
            return live != null && live.contains(value);
        });
    }

    /**
     * The live merged intervals of a metric; empty if none are in effect.
     */
    public List<Bound> activeBounds(ComponentId id, Metric metric) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(metric, "metric");
        if (!registry.isKnown(id)) {
            return List.of();
        }
        return locks.call(id, () -> {
            BoundSet live = liveSet(new Key(id, metric));
            return live != null ? live.intervals() : List.of();
        });
    }

    /**
     * Drops every expired set.
     *
     * @return the number of sets removed
     */
    public int sweep() {
        int removed = 0;
        for (Key key : new ArrayList<>(sets.keySet())) {
            boolean dropped = locks.call(key.componentId(), () -> {
                BoundSet set = sets.get(key);
                return set != null && dropIfExpired(key, set);
            });
            if (dropped) {
                removed++;
            }
        }
        return removed;
    }

    /**
     * Caller holds the component's lock.
     */
    private BoundSet liveSet(Key key) {
        BoundSet set = sets.get(key);
        if (set == null || dropIfExpired(key, set)) {
            return null;
        }
        return set;
    }

    private boolean dropIfExpired(Key key, BoundSet set) {
        if (!set.isExpired(clock.nowNanos())) {
            return false;
        }
        if (sets.remove(key, set)) {
            log.debug("{} {} bounds expired", key.componentId(), key.metric());
            sink.onBoundsEvent(new BoundsEvent.Expired(wallClock.now(), key.componentId(), key.metric()));
        }
        return true;
    }
}
