package com.presetkeeper.api;

/**
 * Bit flags carried by a {@link PresetChange}.
 */
public final class PresetChangeFlags {
    public static final long NONE = 0;

    /** The entity no longer has a preset; the payload names the previous one. */
    public static final long PRESET_WAS_UNASSIGNED = 1L << 0;

    /** The preset was drawn at random rather than requested by name. */
    public static final long RANDOMLY_SELECTED = 1L << 1;

    private PresetChangeFlags() {
    }

    public static boolean isSet(long flags, long flag) {
        return (flags & flag) != 0;
    }
}
