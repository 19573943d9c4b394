package com.presetkeeper.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetNameLookup;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link KeeperConfig} from JSON and validates it.
 */
@Log4j2
public final class ConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {
        // Utility class
    }

    public static KeeperConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            KeeperConfig config = validate(MAPPER.readValue(in, KeeperConfig.class));
            log.info("Loaded configuration from {}", path);
            return config;
        }
    }

    public static KeeperConfig parse(String json) throws IOException {
        return validate(MAPPER.readValue(json, KeeperConfig.class));
    }

    /**
     * Replaces missing collections with empty ones, drops duplicate names and
     * checks the numeric settings.
     *
     * @throws IllegalArgumentException if a setting is out of range or an
     *                                  entity id cannot be parsed.
     */
    static KeeperConfig validate(KeeperConfig config) {
        if (config.getBlacklistedPresetsFromRandomDistribution() == null)
            config.setBlacklistedPresetsFromRandomDistribution(new ArrayList<>());
        else
            config.setBlacklistedPresetsFromRandomDistribution(
                    new ArrayList<>(new LinkedHashSet<>(config.getBlacklistedPresetsFromRandomDistribution())));
        if (config.getNpc() == null)
            config.setNpc(new HashMap<>());

        int ring = config.getRingBufferSize();
        if (ring < 1 || Integer.bitCount(ring) != 1)
            throw new IllegalArgumentException("ringBufferSize must be a power of two: " + ring);
        int stripes = config.getRegistryStripes();
        if (stripes < 1 || Integer.bitCount(stripes) != 1)
            throw new IllegalArgumentException("registryStripes must be a power of two: " + stripes);
        int buffer = config.getCodecBufferSize();
        if (buffer < 8 || buffer % 8 != 0)
            throw new IllegalArgumentException("codecBufferSize must be a multiple of 8 and at least 8: " + buffer);

        for (String key : config.getNpc().keySet())
            parseEntityId(key);
        return config;
    }

    /** Parses {@code 0x}-prefixed hexadecimal or decimal entity ids as unsigned 32-bit values. */
    public static int parseEntityId(String text) {
        String s = text == null ? "" : text.trim();
        try {
            if (s.startsWith("0x") || s.startsWith("0X"))
                return Integer.parseUnsignedInt(s.substring(2), 16);
            return Integer.parseUnsignedInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid entity id '" + text + "'", e);
        }
    }

    /**
     * Builds the per-entity preset name lookup from the {@code npc} section. The
     * same names are offered for either category.
     */
    public static PresetNameLookup nameLookup(KeeperConfig config) {
        Map<Integer, List<String>> byEntity = new HashMap<>();
        config.getNpc().forEach((key, names) -> byEntity.put(parseEntityId(key),
                names == null ? List.of() : names.stream().filter(Objects::nonNull).toList()));
        return (int entityId, PresetCategory category) -> byEntity.getOrDefault(entityId, List.of());
    }
}
