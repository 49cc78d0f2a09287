package com.questrail.microgrid.internal.bounds;

import com.questrail.microgrid.api.Bound;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * BoundSet
 * -----------------------------------------------------------------------------
 * Immutable merged inclusion set of one (component, metric) pair.
 *
 * <h2>Invariant</h2>
 * Intervals are sorted by lower bound and no two of them overlap or touch.
 * All intervals share one expiry, held as a monotonic deadline for the expiry
 * decision and as a wall-clock instant for reporting.
 */
public final class BoundSet
{
    private static final Comparator<Bound> BY_LOWER =
            Comparator.comparingDouble(Bound::lower).thenComparingDouble(Bound::upper);

    private final List<Bound> intervals;
    private final long expiryNanos;
    private final Instant expiresAt;

    private BoundSet(List<Bound> intervals, long expiryNanos, Instant expiresAt) {
        this.intervals = Collections.unmodifiableList(intervals);
        this.expiryNanos = expiryNanos;
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * Builds a set from arbitrary, possibly overlapping intervals.
     */
    public static BoundSet of(Collection<Bound> bounds, long expiryNanos, Instant expiresAt) {
        return new BoundSet(merge(bounds), expiryNanos, expiresAt);
    }

    public List<Bound> intervals() {
        return intervals;
    }

    public long expiryNanos() {
        return expiryNanos;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /**
     * Expired at or after the deadline.
     */
    public boolean isExpired(long nowNanos) {
        return nowNanos - expiryNanos >= 0;
    }

    public boolean contains(double value) {
        for (Bound b : intervals) {
            if (b.contains(value)) {
                return true;
            }
            if (b.lower() > value) {
                return false;
            }
        }
        return false;
    }

    /**
     * Returns a new set holding this set's intervals plus {@code added}, all
     * sharing the given expiry.
     */
    public BoundSet mergedWith(Collection<Bound> added, long newExpiryNanos, Instant newExpiresAt) {
        List<Bound> all = new ArrayList<>(intervals.size() + added.size());
        all.addAll(intervals);
        all.addAll(added);
        return of(all, newExpiryNanos, newExpiresAt);
    }

    /**
     * Standard interval merge: sort by lower bound, then sweep once, folding an
     * interval into the accumulator whenever its lower bound is at most the
     * accumulator's upper bound. Touching intervals merge.
     */
    static List<Bound> merge(Collection<Bound> bounds) {
        List<Bound> sorted = new ArrayList<>(bounds);
        sorted.sort(BY_LOWER);

        List<Bound> merged = new ArrayList<>(sorted.size());
        Bound acc = null;
        for (Bound b : sorted) {
            if (acc == null) {
                acc = b;
            } else if (b.lower() <= acc.upper()) {
                acc = new Bound(acc.lower(), Math.max(acc.upper(), b.upper()));
            } else {
                merged.add(acc);
                acc = b;
            }
        }
        if (acc != null) {
            merged.add(acc);
        }
        return merged;
    }

    @Override
    public String toString() {
        return intervals + " until " + expiresAt;
    }
}
