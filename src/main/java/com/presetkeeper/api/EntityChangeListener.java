package com.presetkeeper.api;

/**
 * Observer of preset changes on entities.
 *
 * Listeners are invoked synchronously on the thread that made the change, in
 * registration order, while the entity's dispatching bit is set. Any change a
 * listener makes to the same entity during the callback does not produce a
 * nested notification.
 *
 * Contract:
 * A listener must not attach or detach listeners from inside a callback. The
 * dispatcher does not detect this; the result is undefined.
 */
public interface EntityChangeListener {

    /**
     * Called after the preset bound to an entity changed.
     *
     * @param entityId The 32-bit entity identifier.
     * @param change   Frozen snapshot of the change. Identical for all listeners
     *                 of one dispatch.
     */
    void onPresetChanged(int entityId, PresetChange change);
}
