package com.presetkeeper.api;

/**
 * Immutable description of one preset change, built once per dispatch and
 * handed unchanged to every listener.
 *
 * @param owner      Name of the component that made the change.
 * @param category   Category the preset belongs to.
 * @param presetName The newly assigned preset, or the previous one when
 *                   {@link PresetChangeFlags#PRESET_WAS_UNASSIGNED} is set
 *                   (empty if that preset is no longer loaded).
 * @param flags      {@link PresetChangeFlags} bits.
 */
public record PresetChange(String owner, PresetCategory category, String presetName, long flags) {

    public boolean wasUnassigned() {
        return PresetChangeFlags.isSet(flags, PresetChangeFlags.PRESET_WAS_UNASSIGNED);
    }

    public boolean wasRandomlySelected() {
        return PresetChangeFlags.isSet(flags, PresetChangeFlags.RANDOMLY_SELECTED);
    }
}
