package com.presetkeeper.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.presetkeeper.core.EntityStateRegistry;
import com.presetkeeper.io.StateSerializer;

import lombok.Data;

/**
 * POJO representation of the keeper configuration file.
 *
 * <pre>
 * {
 *   "codecBufferSize": 65536,
 *   "registryStripes": 64,
 *   "ringBufferSize": 1024,
 *   "blacklistedPresetsFromRandomDistribution": ["Preset A"],
 *   "npc": { "0x0001A6B4": ["Preset B", "Preset C"] }
 * }
 * </pre>
 *
 * Keys of {@code npc} are entity ids, hexadecimal with a {@code 0x} prefix or
 * decimal.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class KeeperConfig {
    private int codecBufferSize = StateSerializer.DEFAULT_BUFFER_SIZE;
    private int registryStripes = EntityStateRegistry.DEFAULT_STRIPES;
    private int ringBufferSize = 1024;
    private List<String> blacklistedPresetsFromRandomDistribution = new ArrayList<>();
    private Map<String, List<String>> npc = new LinkedHashMap<>();

    public static KeeperConfig defaults() {
        return new KeeperConfig();
    }
}
