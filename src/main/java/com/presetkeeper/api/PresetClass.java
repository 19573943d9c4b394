package com.presetkeeper.api;

/**
 * The classifications the preset store keeps for each category.
 */
public enum PresetClass {
    /** Presets eligible for random selection. */
    NORMAL,
    /** Presets excluded from random selection but still assignable by name. */
    EXCLUDED,
    /** Normal presets followed by excluded ones. */
    ALL
}
