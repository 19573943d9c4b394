package com.presetkeeper.api;

/**
 * The 32-bit state tracked for each entity.
 *
 * <pre>
 *  31                  12 11        1   0
 * +----------------------+-----------+---+
 * | preset index + 1     | reserved  | D |
 * +----------------------+-----------+---+
 * </pre>
 *
 * D is set while change notifications for the entity are being dispatched. It
 * is transient and never persisted. The preset slot holds the assigned preset
 * index plus one, so that zero means "no preset".
 *
 * <p>
 * The registry stores the raw bits; this type wraps them with explicit masked
 * accessors so that {@link #PERSISTED_MASK} stays the single definition of what
 * survives a save/restore round trip.
 */
public record EntityState(int bits) {

    public static final int DISPATCHING_BIT = 1;

    public static final int PRESET_SHIFT = 12;
    public static final int PRESET_MASK = ((1 << PresetIndex.BIT_WIDTH) - 1) << PRESET_SHIFT;

    /** Bits that are written to, and accepted from, persisted state. */
    public static final int PERSISTED_MASK = PRESET_MASK;

    public static final EntityState EMPTY = new EntityState(0);

    public static EntityState ofPresetIndex(int presetIndex) {
        return EMPTY.withPresetIndex(presetIndex);
    }

    public boolean isDispatching() {
        return (bits & DISPATCHING_BIT) != 0;
    }

    public EntityState withDispatching(boolean dispatching) {
        return new EntityState(dispatching ? bits | DISPATCHING_BIT : bits & ~DISPATCHING_BIT);
    }

    /** The raw preset slot: assigned index + 1, or 0 when nothing is assigned. */
    public int presetSlot() {
        return (bits & PRESET_MASK) >>> PRESET_SHIFT;
    }

    public boolean hasPreset() {
        return presetSlot() != 0;
    }

    /** The assigned preset index, or {@link PresetIndex#UNASSIGNED}. */
    public int presetIndex() {
        return presetSlot() - 1;
    }

    /**
     * Stores {@code presetIndex + 1} in the preset slot. The largest index does
     * not fit once offset by one, so it is rejected.
     */
    public EntityState withPresetIndex(int presetIndex) {
        PresetIndex.checkValid(presetIndex);
        if (presetIndex + 1 >= PresetIndex.LIMIT)
            throw new IllegalArgumentException("Preset index " + presetIndex + " cannot be stored in an entity state");
        return new EntityState((bits & ~PRESET_MASK) | ((presetIndex + 1) << PRESET_SHIFT));
    }

    public EntityState withoutPreset() {
        return new EntityState(bits & ~PRESET_MASK);
    }

    /** The subset of this state that is written to the save. */
    public EntityState persisted() {
        return new EntityState(bits & PERSISTED_MASK);
    }

    @Override
    public String toString() {
        return "EntityState[preset=" + presetIndex() + ", dispatching=" + isDispatching()
                + ", bits=0x" + Integer.toHexString(bits) + "]";
    }
}
