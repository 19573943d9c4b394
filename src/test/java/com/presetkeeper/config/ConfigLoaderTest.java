package com.presetkeeper.config;

import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetNameLookup;
import org.junit.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class ConfigLoaderTest {

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ConfigLoaderTest.class.getResource("/" + name).toURI());
    }

    @Test
    public void testLoadsFile() throws Exception {
        KeeperConfig config = ConfigLoader.load(resource("keeper-config.json"));
        assertEquals(16, config.getCodecBufferSize());
        assertEquals(8, config.getRegistryStripes());
        assertEquals(64, config.getRingBufferSize());
        assertEquals(List.of("Medusa", "Hades"), config.getBlacklistedPresetsFromRandomDistribution());
    }

    @Test
    public void testNameLookupParsesHexAndDecimalIds() throws Exception {
        KeeperConfig config = ConfigLoader.load(resource("keeper-config.json"));
        PresetNameLookup lookup = ConfigLoader.nameLookup(config);
        assertEquals(List.of("Athena", "Missing One"), lookup.presetNamesFor(0x0001A6B4, PresetCategory.FEMALE));
        assertEquals(List.of("Ares"), lookup.presetNamesFor(42, PresetCategory.MALE));
        assertEquals(List.of(), lookup.presetNamesFor(43, PresetCategory.MALE));
    }

    @Test
    public void testDefaultsForMissingKeys() throws IOException {
        KeeperConfig config = ConfigLoader.parse("{}");
        assertEquals(KeeperConfig.defaults(), config);
        assertEquals(65536, config.getCodecBufferSize());
        assertEquals(64, config.getRegistryStripes());
        assertTrue(config.getNpc().isEmpty());
    }

    @Test
    public void testNullCollectionsBecomeEmpty() throws IOException {
        KeeperConfig config = ConfigLoader.parse("{\"npc\": null, \"blacklistedPresetsFromRandomDistribution\": null}");
        assertNotNull(config.getNpc());
        assertNotNull(config.getBlacklistedPresetsFromRandomDistribution());
    }

    @Test
    public void testParseEntityId() {
        assertEquals(0xFF000001, ConfigLoader.parseEntityId("0xFF000001"));
        assertEquals(0x14, ConfigLoader.parseEntityId(" 0X14 "));
        assertEquals(20, ConfigLoader.parseEntityId("20"));
        try {
            ConfigLoader.parseEntityId("Lydia");
            fail("Name accepted as id");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testInvalidSettingsAreRejected() throws IOException {
        for (String json : List.of("{\"ringBufferSize\": 1000}", "{\"registryStripes\": 3}",
                "{\"codecBufferSize\": 12}", "{\"npc\": {\"abc\": [\"Athena\"]}}")) {
            try {
                ConfigLoader.parse(json);
                fail("Accepted " + json);
            } catch (IllegalArgumentException expected) {
            }
        }
    }
}
