package com.presetkeeper.api;

/**
 * The two independent preset namespaces.
 *
 * Each category owns its own name-to-index table, next-free-index counter and
 * sparse index array. The declaration order is the order in which categories
 * are written to (and read from) the persisted preset-index map.
 */
public enum PresetCategory {
    FEMALE,
    MALE;

    public PresetCategory opposite() {
        return this == FEMALE ? MALE : FEMALE;
    }
}
