package com.questrail.microgrid.internal.exec;

import com.questrail.microgrid.api.ComponentId;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * ComponentLocks
 * =============================================================================
 * Per-component critical sections.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Every read-then-write of a component's lifecycle state, bound sets or
 *       power commands runs inside {@link #call} / {@link #run} for that component.</li>
 *   <li>Timer callbacks take the same lock before mutating anything.</li>
 *   <li>No caller ever holds two components' locks, so no lock ordering is
 *       needed and deadlock cannot occur.</li>
 *   <li>Locks are allocated on first use and never released. Callers check
 *       that the component is registered before asking for its lock.</li>
 * </ul>
 *
 * <p>Locks are reentrant: a lifecycle transition may clear the component's
 * power commands while still inside its own critical section.</p>
 */
public final class ComponentLocks {

    private final ConcurrentMap<ComponentId, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} under the component's lock and returns its result.
     */
    public <T> T call(ComponentId id, Supplier<T> action) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");

        ReentrantLock lock = lockFor(id);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} under the component's lock.
     */
    public void run(ComponentId id, Runnable action) {
        Objects.requireNonNull(action, "action");
        call(id, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Whether the calling thread currently holds the component's lock.
     */
    public boolean isHeldByCurrentThread(ComponentId id) {
        ReentrantLock lock = locks.get(id);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /**
     * Number of components that currently have a lock allocated.
     */
    public int size() {
        return locks.size();
    }

    private ReentrantLock lockFor(ComponentId id) {
        return locks.computeIfAbsent(id, k -> new ReentrantLock());
    }
}
