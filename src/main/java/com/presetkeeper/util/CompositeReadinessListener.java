package com.presetkeeper.util;

import com.presetkeeper.api.ReadinessListener;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Aggregates multiple {@link ReadinessListener} instances with
 * zero-allocation iteration.
 *
 * Adding and removing copy the array; broadcasts iterate whichever array was
 * current when they started. A listener that throws is logged and the rest are
 * still called.
 */
public class CompositeReadinessListener implements ReadinessListener {
    private static final Logger log = LogManager.getLogger(CompositeReadinessListener.class);

    private volatile ReadinessListener[] listeners = new ReadinessListener[0];

    /** @return false if the listener was already present. */
    public synchronized boolean addForComposite(ReadinessListener listener) {
        ReadinessListener[] old = listeners;
        for (ReadinessListener l : old)
            if (l == listener)
                return false;
        ReadinessListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return true;
    }

    /** @return false if the listener was not present. */
    public synchronized boolean removeFromComposite(ReadinessListener listener) {
        ReadinessListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                ReadinessListener[] next = new ReadinessListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void becomingReady() {
        for (ReadinessListener l : listeners) {
            try {
                l.becomingReady();
            } catch (RuntimeException e) {
                log.error("Readiness listener {} failed in becomingReady", l, e);
            }
        }
    }

    @Override
    public void ready() {
        for (ReadinessListener l : listeners) {
            try {
                l.ready();
            } catch (RuntimeException e) {
                log.error("Readiness listener {} failed in ready", l, e);
            }
        }
    }

    @Override
    public void becomingUnready() {
        for (ReadinessListener l : listeners) {
            try {
                l.becomingUnready();
            } catch (RuntimeException e) {
                log.error("Readiness listener {} failed in becomingUnready", l, e);
            }
        }
    }

    @Override
    public void noLongerReady() {
        for (ReadinessListener l : listeners) {
            try {
                l.noLongerReady();
            } catch (RuntimeException e) {
                log.error("Readiness listener {} failed in noLongerReady", l, e);
            }
        }
    }
}
