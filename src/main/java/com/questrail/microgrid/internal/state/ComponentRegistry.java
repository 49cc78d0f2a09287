package com.questrail.microgrid.internal.state;

import com.questrail.microgrid.api.ComponentCategory;
import com.questrail.microgrid.api.ComponentId;
import com.questrail.microgrid.api.ControlException;
import com.questrail.microgrid.driver.ComponentFeatures;

import java.time.Instant;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ComponentRegistry
 * -----------------------------------------------------------------------------
 * Authoritative in-memory table of {@link ComponentRecord}s for one session.
 *
 * <p>Records are created when the external inventory discovers a component and
 * are never removed while the session runs; a component that stops answering
 * is flagged unreachable instead.</p>
 *
 * <p>Individual reads and writes are atomic. Read-then-write sequences must run
 * under the component's lock.</p>
 */
public final class ComponentRegistry
{
    private final ConcurrentMap<ComponentId, ComponentRecord> records = new ConcurrentHashMap<>();

    /**
     * Registers a discovered component, or refreshes the features of a known
     * one and marks it reachable again.
     */
    public ComponentRecord register(ComponentId id,
                                    ComponentCategory category,
                                    ComponentFeatures features,
                                    Instant now) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(features, "features");

        return records.compute(id, (k, existing) -> {
            if (existing == null) {
                return ComponentRecord.discovered(id, category, features, now);
            }
            if (existing.category() != category) {
                throw new IllegalArgumentException(
                        id + " already registered as " + existing.category() + ", not " + category);
            }
            return existing.withFeatures(features).withReachable(true, now);
        });
    }

    public Optional<ComponentRecord> find(ComponentId id) {
        return Optional.ofNullable(records.get(id));
    }

    /**
     * Whether {@code id} was ever registered, reachable or not. Checked before
     * taking a component lock so that unknown ids never allocate one.
     */
    public boolean isKnown(ComponentId id) {
        return id != null && records.containsKey(id);
    }

    /**
     * @throws ControlException {@code NOT_FOUND} if the component was never registered
     */
    public void requireKnown(ComponentId id) {
        Objects.requireNonNull(id, "id");
        if (!records.containsKey(id)) {
            throw ControlException.notFound(id, "unknown component " + id);
        }
    }

    /**
     * Returns the record of a known, reachable component.
     *
     * @throws ControlException {@code NOT_FOUND} if the component is unknown or stale
     */
    public ComponentRecord require(ComponentId id) {
        Objects.requireNonNull(id, "id");
        ComponentRecord record = records.get(id);
        if (record == null) {
            throw ControlException.notFound(id, "unknown component " + id);
        }
        if (!record.reachable()) {
            throw ControlException.notFound(id, id + " is unreachable");
        }
        return record;
    }

    void put(ComponentRecord record) {
        records.put(record.id(), record);
    }

    public Collection<ComponentRecord> all() {
        return records.values();
    }
}
