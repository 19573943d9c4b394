package com.presetkeeper.wiring;

import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetChange;

/**
 * A mutable holder for one preset change, used within the LMAX Disruptor
 * RingBuffer.
 *
 * <p>
 * <b>Flyweight Pattern:</b> Instances are pre-allocated when the ring buffer is
 * built and reused for its lifetime. Handlers must copy what they need before
 * returning; the slot is overwritten by a later change.
 */
public final class ChangeEvent {
    private int entityId;
    private String owner;
    private PresetCategory category;
    private String presetName;
    private long flags;

    /**
     * Copies a frozen change into this slot.
     *
     * @param entityId Entity the change applies to.
     * @param change   Frozen payload of the dispatch.
     */
    public void set(int entityId, PresetChange change) {
        this.entityId = entityId;
        this.owner = change.owner();
        this.category = change.category();
        this.presetName = change.presetName();
        this.flags = change.flags();
    }

    public int entityId() {
        return entityId;
    }

    public String owner() {
        return owner;
    }

    public PresetCategory category() {
        return category;
    }

    public String presetName() {
        return presetName;
    }

    public long flags() {
        return flags;
    }

    /** Rebuilds the immutable payload. Allocates. */
    public PresetChange toChange() {
        return new PresetChange(owner, category, presetName, flags);
    }

    public void clear() {
        entityId = 0;
        owner = null;
        category = null;
        presetName = null;
        flags = 0;
    }
}
