package com.presetkeeper.core;

import com.presetkeeper.api.EntityState;
import com.presetkeeper.util.ErrorRateLimiter;

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Broadcasts per-entity change events to a list of listeners without feedback
 * loops.
 *
 * Recursion Guard:
 * The entity's {@link EntityState#DISPATCHING_BIT} is checked and set in a
 * single {@link EntityStateRegistry#emplaceOrVisit} call before any listener
 * runs, and cleared when the last listener returns. A dispatch for an entity
 * whose bit is already set is dropped silently. Without this, two listeners
 * that keep "correcting" the same entity in opposite directions would recurse
 * until the stack overflows.
 *
 * Frozen Arguments:
 * The event arguments are built exactly once, before the first listener is
 * invoked, and every listener receives that same object. Changes listeners make
 * to the world are not reflected in the arguments of the current dispatch.
 *
 * Locking:
 * Attaching, detaching and dispatching share one reentrant lock, separate from
 * the registry's stripe locks. It is held for the whole dispatch, so the
 * listener array cannot change mid-iteration. A listener must not attach or
 * detach listeners from inside a callback; this is a caller contract and is not
 * checked.
 *
 * @param <L> Listener type.
 */
public final class EntityEventDispatcher<L> {
    private static final Logger log = LogManager.getLogger(EntityEventDispatcher.class);

    /** Delivers one event to one listener. */
    @FunctionalInterface
    public interface Invoker<L, A> {
        void invoke(L listener, int entityId, A args);
    }

    private final EntityStateRegistry registry;
    private final ReentrantLock lock = new ReentrantLock();
    private final ErrorRateLimiter errorLimiter = new ErrorRateLimiter(log, 1000);

    private Object[] listeners = new Object[0];

    public EntityEventDispatcher(EntityStateRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers a listener.
     *
     * @return false if the listener was already attached.
     */
    public boolean attach(L listener) {
        lock.lock();
        try {
            if (indexOf(listener) >= 0)
                return false;
            Object[] old = listeners;
            Object[] next = Arrays.copyOf(old, old.length + 1);
            next[old.length] = listener;
            listeners = next;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a listener.
     *
     * @return false if the listener was not attached.
     */
    public boolean detach(L listener) {
        lock.lock();
        try {
            int i = indexOf(listener);
            if (i < 0)
                return false;
            Object[] old = listeners;
            Object[] next = new Object[old.length - 1];
            System.arraycopy(old, 0, next, 0, i);
            System.arraycopy(old, i + 1, next, i, old.length - i - 1);
            listeners = next;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isAttached(L listener) {
        lock.lock();
        try {
            return indexOf(listener) >= 0;
        } finally {
            lock.unlock();
        }
    }

    public int listenerCount() {
        lock.lock();
        try {
            return listeners.length;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends one event for {@code entityId} to every attached listener.
     *
     * Steps:
     * 1. Return if no listener is attached (the registry is not touched).
     * 2. Check-and-set the entity's dispatching bit; return if it was set.
     * 3. Build the arguments once.
     * 4. Invoke the listeners in registration order. A listener that throws is
     * logged and the remaining listeners still run.
     * 5. Clear the dispatching bit, also when building the arguments failed.
     *
     * @return true if the event was delivered, false if it was dropped because
     *         there were no listeners or a dispatch for the entity was already in
     *         progress.
     */
    @SuppressWarnings("unchecked")
    public <A> boolean dispatch(int entityId, Supplier<A> buildArgs, Invoker<? super L, ? super A> invoker) {
        lock.lock();
        try {
            final Object[] ls = listeners;
            if (ls.length == 0)
                return false;

            EntityState before = registry.emplaceOrVisit(entityId, EntityState.EMPTY,
                    s -> s.withDispatching(true));
            if (before.isDispatching()) {
                log.trace("Dropped recursive change event for entity {}", entityId);
                return false;
            }

            try {
                final A args = buildArgs.get();
                for (Object l : ls) {
                    try {
                        invoker.invoke((L) l, entityId, args);
                    } catch (RuntimeException e) {
                        errorLimiter.log("Listener " + l + " failed for entity " + entityId, e);
                    }
                }
            } finally {
                registry.visit(entityId, s -> s.withDispatching(false));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    private int indexOf(L listener) {
        final Object[] ls = listeners;
        for (int i = 0; i < ls.length; i++)
            if (ls[i] == listener)
                return i;
        return -1;
    }
}
