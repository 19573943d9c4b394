package com.presetkeeper.api;

/**
 * Constants and checks for preset indexes.
 *
 * A preset index is an unsigned 20-bit integer scoped to one
 * {@link PresetCategory}. Indexes are handed out in increasing order and are
 * never reused, so they stay stable across save/restore cycles even when the
 * preset that first claimed an index is later removed.
 */
public final class PresetIndex {

    /** Width of a preset index in bits. */
    public static final int BIT_WIDTH = 20;

    /** Exclusive upper bound of a preset index (1,048,576). */
    public static final int LIMIT = 1 << BIT_WIDTH;

    /** Marker for a preset whose index has not been assigned yet. */
    public static final int UNASSIGNED = -1;

    private PresetIndex() {
    }

    public static boolean isValid(int index) {
        return index >= 0 && index < LIMIT;
    }

    public static int checkValid(int index) {
        if (!isValid(index))
            throw new IllegalArgumentException("Preset index out of range: " + index);
        return index;
    }
}
