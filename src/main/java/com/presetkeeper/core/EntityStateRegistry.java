package com.presetkeeper.core;

import com.presetkeeper.api.EntityState;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Concurrent map from a 32-bit entity id to its 32-bit {@link EntityState}.
 *
 * Layout: Lock Striping over Primitive Tables
 * The key space is split into a power-of-two number of stripes by the low bits
 * of a mixed hash. Each stripe owns a lock and an open-addressing table made of
 * parallel int arrays (keys, values) plus an occupancy array, probed linearly
 * with the remaining hash bits. There is no global lock: callers touching
 * entities in different stripes never contend, and every operation on one key
 * runs under that key's stripe lock, so updates to the same entity are
 * mutually exclusive.
 *
 * Values are stored as raw bits; {@link EntityState} instances are only created
 * at the API boundary.
 *
 * Entries are never removed individually. {@link #clear()} drops everything.
 */
public final class EntityStateRegistry {

    public static final int DEFAULT_STRIPES = 64;
    public static final int MAX_STRIPES = 1 << 16;

    private static final int INITIAL_STRIPE_CAPACITY = 16;
    private static final int MAX_STRIPE_CAPACITY = 1 << 30;

    /** Receives entries during iteration. Return false to stop early. */
    @FunctionalInterface
    public interface EntryVisitor {
        boolean visit(int entityId, EntityState state);
    }

    private final Stripe[] stripes;
    private final int stripeMask;
    private final int stripeBits;

    public EntityStateRegistry() {
        this(DEFAULT_STRIPES);
    }

    /**
     * @param stripeCount number of lock stripes; must be a power of two between
     *                    1 and {@link #MAX_STRIPES}.
     */
    public EntityStateRegistry(int stripeCount) {
        if (stripeCount < 1 || stripeCount > MAX_STRIPES || Integer.bitCount(stripeCount) != 1)
            throw new IllegalArgumentException("Stripe count must be a power of two in [1, " + MAX_STRIPES + "]: "
                    + stripeCount);
        this.stripeMask = stripeCount - 1;
        this.stripeBits = Integer.numberOfTrailingZeros(stripeCount);
        this.stripes = new Stripe[stripeCount];
        for (int i = 0; i < stripeCount; i++)
            stripes[i] = new Stripe(stripeBits);
    }

    /**
     * Applies {@code fn} to the entity's state if it has one.
     *
     * @return false when the entity has no entry (fn is not called).
     */
    public boolean visit(int entityId, UnaryOperator<EntityState> fn) {
        final int h = mix(entityId);
        final Stripe s = stripeFor(h);
        s.lock.lock();
        try {
            int slot = s.find(entityId, h >>> stripeBits);
            if (slot < 0)
                return false;
            s.values[slot] = apply(fn, s.values[slot]);
            return true;
        } finally {
            s.lock.unlock();
        }
    }

    /**
     * Inserts {@code defaultValue} if the entity has no entry, then applies
     * {@code fn} to the entry in either case.
     *
     * @return the state seen by {@code fn}, i.e. the state before this call's
     *         update ({@code defaultValue} when the entry was just inserted).
     */
    public EntityState emplaceOrVisit(int entityId, EntityState defaultValue, UnaryOperator<EntityState> fn) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        final int h = mix(entityId);
        final Stripe s = stripeFor(h);
        s.lock.lock();
        try {
            int slot = s.find(entityId, h >>> stripeBits);
            if (slot < 0)
                slot = s.insert(entityId, defaultValue.bits(), h >>> stripeBits, -slot - 1);
            EntityState before = new EntityState(s.values[slot]);
            s.values[slot] = apply(fn, before.bits());
            return before;
        } finally {
            s.lock.unlock();
        }
    }

    /** Inserts or overwrites the entity's state. */
    public void put(int entityId, EntityState state) {
        final int h = mix(entityId);
        final Stripe s = stripeFor(h);
        s.lock.lock();
        try {
            int slot = s.find(entityId, h >>> stripeBits);
            if (slot < 0)
                s.insert(entityId, state.bits(), h >>> stripeBits, -slot - 1);
            else
                s.values[slot] = state.bits();
        } finally {
            s.lock.unlock();
        }
    }

    /** Point read. Returns null when the entity has no entry. */
    public EntityState get(int entityId) {
        final int h = mix(entityId);
        final Stripe s = stripeFor(h);
        s.lock.lock();
        try {
            int slot = s.find(entityId, h >>> stripeBits);
            return slot < 0 ? null : new EntityState(s.values[slot]);
        } finally {
            s.lock.unlock();
        }
    }

    /** The entity's assigned preset index, or -1 when none is assigned. */
    public int presetIndexOf(int entityId) {
        EntityState state = get(entityId);
        return state == null ? -1 : state.presetIndex();
    }

    public boolean contains(int entityId) {
        return get(entityId) != null;
    }

    /**
     * Visits every entry until the visitor returns false.
     *
     * Each stripe is copied under its lock and visited after the lock is
     * released, so the visitor may call back into the registry. Entries added or
     * changed concurrently may or may not be seen.
     *
     * @return true if every entry was visited.
     */
    public boolean forEachWhile(EntryVisitor visitor) {
        for (Stripe s : stripes) {
            int[] keys;
            int[] values;
            int n = 0;
            s.lock.lock();
            try {
                keys = new int[s.size];
                values = new int[s.size];
                for (int i = 0; i < s.used.length; i++) {
                    if (s.used[i]) {
                        keys[n] = s.keys[i];
                        values[n] = s.values[i];
                        n++;
                    }
                }
            } finally {
                s.lock.unlock();
            }
            for (int i = 0; i < n; i++)
                if (!visitor.visit(keys[i], new EntityState(values[i])))
                    return false;
        }
        return true;
    }

    public int size() {
        int total = 0;
        for (Stripe s : stripes) {
            s.lock.lock();
            try {
                total += s.size;
            } finally {
                s.lock.unlock();
            }
        }
        return total;
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        for (Stripe s : stripes) {
            s.lock.lock();
            try {
                s.reset(INITIAL_STRIPE_CAPACITY);
            } finally {
                s.lock.unlock();
            }
        }
    }

    public int stripeCount() {
        return stripes.length;
    }

    private Stripe stripeFor(int hash) {
        return stripes[hash & stripeMask];
    }

    private static int apply(UnaryOperator<EntityState> fn, int bits) {
        return Objects.requireNonNull(fn.apply(new EntityState(bits)), "state update returned null").bits();
    }

    /** Murmur3 finaliser; entity ids are often sequential. */
    static int mix(int key) {
        int h = key;
        h ^= h >>> 16;
        h *= 0x85ebca6b;
        h ^= h >>> 13;
        h *= 0xc2b2ae35;
        h ^= h >>> 16;
        return h;
    }

    /** One lock plus its open-addressing table. Guarded by {@code lock}. */
    private static final class Stripe {
        final ReentrantLock lock = new ReentrantLock();
        // Hash bits consumed by stripe selection; probing uses the rest.
        final int probeShift;
        int[] keys;
        int[] values;
        boolean[] used;
        int size;
        int mask;
        int resizeThreshold;

        Stripe(int probeShift) {
            this.probeShift = probeShift;
            reset(INITIAL_STRIPE_CAPACITY);
        }

        void reset(int capacity) {
            keys = new int[capacity];
            values = new int[capacity];
            used = new boolean[capacity];
            size = 0;
            mask = capacity - 1;
            resizeThreshold = capacity - (capacity >>> 2);
        }

        /**
         * @return the slot holding {@code key}, or {@code -(freeSlot + 1)} where
         *         the probe ended.
         */
        int find(int key, int probeHash) {
            int i = probeHash & mask;
            while (used[i]) {
                if (keys[i] == key)
                    return i;
                i = (i + 1) & mask;
            }
            return -(i + 1);
        }

        /** Inserts into a free slot found by {@link #find}; returns the final slot. */
        int insert(int key, int value, int probeHash, int freeSlot) {
            if (size + 1 > resizeThreshold) {
                grow();
                freeSlot = -find(key, probeHash) - 1;
            }
            keys[freeSlot] = key;
            values[freeSlot] = value;
            used[freeSlot] = true;
            size++;
            return freeSlot;
        }

        private void grow() {
            if (keys.length >= MAX_STRIPE_CAPACITY)
                throw new IllegalStateException("Entity state stripe is full");
            int[] oldKeys = keys;
            int[] oldValues = values;
            boolean[] oldUsed = used;
            int oldSize = size;
            reset(keys.length << 1);
            for (int i = 0; i < oldUsed.length; i++) {
                if (!oldUsed[i])
                    continue;
                int j = (mix(oldKeys[i]) >>> probeShift) & mask;
                while (used[j])
                    j = (j + 1) & mask;
                keys[j] = oldKeys[i];
                values[j] = oldValues[i];
                used[j] = true;
            }
            size = oldSize;
        }
    }
}
