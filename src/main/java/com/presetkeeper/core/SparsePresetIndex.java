package com.presetkeeper.core;

import com.presetkeeper.api.PresetIndex;

import java.util.Arrays;

/**
 * Maps a sparse preset index to the dense slot of the preset in its
 * category's "all" list.
 *
 * Data layout:
 * - slots[index] is the dense slot of the preset holding that index, or
 * {@link #ABSENT} when no loaded preset holds it (the preset was removed, or
 * the index was only reserved by the opposite category).
 *
 * A plain array is used rather than a hash table because the indexes are
 * expected to be dense. The array only ever grows. Growth publishes a new
 * array through a volatile field so readers never take a lock; mutation is
 * serialised on this object.
 */
public final class SparsePresetIndex {
    public static final int ABSENT = -1;

    private static final int MIN_CAPACITY = 16;

    private volatile int[] slots = new int[0];

    /** Number of index positions currently backed by the array. */
    public int capacity() {
        return slots.length;
    }

    /**
     * Returns the dense slot for a preset index, or {@link #ABSENT} when the
     * index is unoccupied or out of bounds.
     */
    public int denseSlot(int presetIndex) {
        final int[] s = slots;
        if (presetIndex < 0 || presetIndex >= s.length)
            return ABSENT;
        return s[presetIndex];
    }

    /**
     * Grows the array so it covers at least {@code required} indexes. New
     * positions are {@link #ABSENT}.
     */
    public synchronized void ensureCapacity(int required) {
        final int[] s = slots;
        if (required <= s.length)
            return;
        if (required > PresetIndex.LIMIT)
            throw new IllegalStateException("Sparse preset index cannot exceed " + PresetIndex.LIMIT + " entries");
        int newLength = Math.max(required, Math.max(MIN_CAPACITY, s.length * 2));
        newLength = Math.min(newLength, PresetIndex.LIMIT);
        int[] grown = Arrays.copyOf(s, newLength);
        Arrays.fill(grown, s.length, newLength, ABSENT);
        slots = grown;
    }

    public synchronized void set(int presetIndex, int denseSlot) {
        ensureCapacity(presetIndex + 1);
        slots[presetIndex] = denseSlot;
    }

    /** Marks every position absent. The capacity is kept. */
    public synchronized void clear() {
        Arrays.fill(slots, ABSENT);
    }

    /** Number of positions that map to a loaded preset. */
    public int occupiedCount() {
        int n = 0;
        for (int slot : slots)
            if (slot != ABSENT)
                n++;
        return n;
    }
}
