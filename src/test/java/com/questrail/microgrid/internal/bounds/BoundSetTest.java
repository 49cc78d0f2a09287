package com.questrail.microgrid.internal.bounds;

import com.questrail.microgrid.api.Bound;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundSetTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void overlappingIntervalMergesWithItsNeighbour() {
        BoundSet set = BoundSet.of(List.of(Bound.of(0, 10), Bound.of(20, 30)), 0, T)
                .mergedWith(List.of(Bound.of(5, 15)), 0, T);

        assertEquals(List.of(Bound.of(0, 15), Bound.of(20, 30)), set.intervals());
    }

    @Test
    void touchingIntervalsMerge() {
        assertEquals(List.of(Bound.of(0, 20)), BoundSet.merge(List.of(Bound.of(10, 20), Bound.of(0, 10))));
    }

    @Test
    void bridgingIntervalCollapsesEverything() {
        List<Bound> merged = BoundSet.merge(List.of(
                Bound.of(0, 1), Bound.of(2, 3), Bound.of(4, 5), Bound.of(-1, 6)));

        assertEquals(List.of(Bound.of(-1, 6)), merged);
    }

    @Test
    void containedIntervalIsAbsorbed() {
        assertEquals(List.of(Bound.of(0, 100)), BoundSet.merge(List.of(Bound.of(0, 100), Bound.of(40, 60))));
    }

    @Test
    void mergeDoesNotDependOnInputOrder() {
        List<Bound> input = new ArrayList<>(List.of(
                Bound.of(-50, -10), Bound.of(5, 8), Bound.of(7, 12), Bound.of(30, 30), Bound.of(-10, 0)));
        List<Bound> expected = BoundSet.merge(input);

        for (int i = 0; i < 10; i++) {
            Collections.rotate(input, 1);
            if (i % 3 == 0) {
                Collections.reverse(input);
            }
            assertEquals(expected, BoundSet.merge(input));
        }
        assertEquals(List.of(Bound.of(-50, 0), Bound.of(5, 12), Bound.of(30, 30)), expected);
    }

    @Test
    void pointBoundContainsOnlyItsValue() {
        BoundSet set = BoundSet.of(List.of(Bound.of(42, 42)), 0, T);

        assertTrue(set.contains(42));
        assertFalse(set.contains(42.0001));
        assertFalse(set.contains(41.9999));
    }

    @Test
    void containsIsInclusiveAtBothEnds() {
        BoundSet set = BoundSet.of(List.of(Bound.of(-10, -5), Bound.of(5, 10)), 0, T);

        assertTrue(set.contains(-10));
        assertTrue(set.contains(-5));
        assertTrue(set.contains(5));
        assertTrue(set.contains(10));
        assertFalse(set.contains(0));
        assertFalse(set.contains(11));
    }

    @Test
    void expiresExactlyAtTheDeadline() {
        BoundSet set = BoundSet.of(List.of(Bound.of(0, 1)), 1_000, T);

        assertFalse(set.isExpired(999));
        assertTrue(set.isExpired(1_000));
        assertTrue(set.isExpired(1_001));
    }

    @Test
    void mergedSetAdoptsTheNewExpiry() {
        Instant later = T.plusSeconds(60);
        BoundSet set = BoundSet.of(List.of(Bound.of(0, 1)), 100, T)
                .mergedWith(List.of(Bound.of(5, 6)), 500, later);

        assertEquals(500, set.expiryNanos());
        assertEquals(later, set.expiresAt());
    }
}
