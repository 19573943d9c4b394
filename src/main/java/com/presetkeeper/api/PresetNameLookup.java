package com.presetkeeper.api;

import java.util.List;

/**
 * Supplies the preset names an entity may be given when it is assigned a
 * random preset. Backed by configuration; the keeper never reads the
 * configuration format itself.
 */
@FunctionalInterface
public interface PresetNameLookup {

    /**
     * @return the allowed names, or an empty list when any normal preset of the
     *         category may be chosen.
     */
    List<String> presetNamesFor(int entityId, PresetCategory category);
}
