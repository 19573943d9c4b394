package com.presetkeeper.io;

import com.presetkeeper.api.EntityState;
import com.presetkeeper.api.Preset;
import com.presetkeeper.api.RecordStream;
import com.presetkeeper.core.EntityStateRegistry;
import com.presetkeeper.core.PresetIndexAllocator;
import com.presetkeeper.core.PresetStore;
import org.junit.Before;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.presetkeeper.api.PresetCategory.FEMALE;
import static com.presetkeeper.api.PresetCategory.MALE;
import static com.presetkeeper.io.StateSerializer.ENTITY_REGISTRY_TYPE;
import static com.presetkeeper.io.StateSerializer.PRESET_INDEX_MAP_TYPE;
import static org.junit.Assert.*;

public class StateSerializerTest {

    private PresetStore store;
    private PresetIndexAllocator allocator;
    private EntityStateRegistry registry;

    @Before
    public void setUp() {
        store = new PresetStore();
        allocator = new PresetIndexAllocator(store);
        registry = new EntityStateRegistry(8);
    }

    private StateSerializer serializer(int bufferSize) {
        return new StateSerializer(registry, allocator, store, bufferSize);
    }

    /** A second, empty set of structures to load into. */
    private static final class Target {
        final PresetStore store = new PresetStore();
        final PresetIndexAllocator allocator = new PresetIndexAllocator(store);
        final EntityStateRegistry registry = new EntityStateRegistry(2);

        StateSerializer serializer(int bufferSize) {
            return new StateSerializer(registry, allocator, store, bufferSize);
        }
    }

    private static byte[] le(int... values) {
        byte[] out = new byte[values.length * 4];
        for (int i = 0; i < values.length; i++) {
            out[i * 4] = (byte) values[i];
            out[i * 4 + 1] = (byte) (values[i] >>> 8);
            out[i * 4 + 2] = (byte) (values[i] >>> 16);
            out[i * 4 + 3] = (byte) (values[i] >>> 24);
        }
        return out;
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts)
            out.write(p, 0, p.length);
        return out.toByteArray();
    }

    @Test
    public void testRecordLayout() {
        allocator.getOrAssignIndex(FEMALE, "Ab");
        registry.put(0x01020304, EntityState.ofPresetIndex(0).withDispatching(true));

        MemoryRecordStream out = new MemoryRecordStream();
        assertTrue(serializer(8).save(out));
        assertEquals(2, out.recordCount());
        assertEquals(new RecordStream.RecordInfo(PRESET_INDEX_MAP_TYPE, 0, 40), out.recordInfo(0));
        assertEquals(new RecordStream.RecordInfo(ENTITY_REGISTRY_TYPE, 0, 8), out.recordInfo(1));

        byte[] category = concat(le(1, 2, 0), new byte[] { 'A', 'b', 0, 0 }, le(0));
        assertArrayEquals(concat(category, category), out.recordData(0));
        assertArrayEquals(new byte[] { 4, 3, 2, 1, 0, 0x10, 0, 0 }, out.recordData(1));
    }

    @Test
    public void testRoundTripAcrossBufferAndChunkSizes() {
        for (int i = 0; i < 30; i++)
            allocator.getOrAssignIndex(i % 3 == 0 ? MALE : FEMALE, "Preset number " + i);
        allocator.getOrAssignIndex(FEMALE, "Ünïcödé ✓ preset with a rather long name that spans many buffers");
        for (int id = 0; id < 300; id++)
            registry.put(id * 7919, EntityState.ofPresetIndex(id % 31).withDispatching(id % 5 == 0));
        registry.put(-5, EntityState.EMPTY);

        MemoryRecordStream saved = new MemoryRecordStream();
        assertTrue(serializer(8).save(saved));

        for (int bufferSize : new int[] { 8, 16, 24, 4096 }) {
            for (int chunk : new int[] { 1, 3, 5, 8, 1000 }) {
                Target t = new Target();
                assertTrue(t.serializer(bufferSize).load(saved.withReadChunkSize(chunk)));

                for (var c : List.of(FEMALE, MALE))
                    assertEquals(allocator.snapshot(c), t.allocator.snapshot(c));
                assertEquals(registry.size(), t.registry.size());
                registry.forEachWhile((id, s) -> {
                    EntityState restored = t.registry.get(id);
                    assertEquals(s.persisted(), restored);
                    assertFalse(restored.isDispatching());
                    return true;
                });
            }
        }
    }

    @Test
    public void testTruncatedRegistryRecordLeavesRegistryEmpty() {
        allocator.getOrAssignIndex(FEMALE, "Athena");
        registry.put(1, EntityState.ofPresetIndex(0));
        MemoryRecordStream saved = new MemoryRecordStream();
        serializer(16).save(saved);

        byte[] registryData = saved.recordData(1);
        MemoryRecordStream broken = new MemoryRecordStream()
                .addRecord(PRESET_INDEX_MAP_TYPE, 0, saved.recordData(0))
                .addRecord(ENTITY_REGISTRY_TYPE, 0, Arrays.copyOf(registryData, registryData.length + 4));

        Target t = new Target();
        t.registry.put(99, EntityState.ofPresetIndex(3));
        assertFalse(t.serializer(16).load(broken));
        assertTrue(t.registry.isEmpty());
        assertEquals(0, t.allocator.lookupIndex(FEMALE, "Athena"));
    }

    @Test
    public void testIndexAtOrAboveCounterLeavesTablesEmpty() {
        byte[] bad = concat(le(1, 4, 1), "Athe".getBytes(StandardCharsets.US_ASCII), le(0), le(0, 0));
        MemoryRecordStream in = new MemoryRecordStream()
                .addRecord(PRESET_INDEX_MAP_TYPE, 0, bad)
                .addRecord(ENTITY_REGISTRY_TYPE, 0, le(5, 1 << EntityState.PRESET_SHIFT));

        Target t = new Target();
        t.allocator.getOrAssignIndex(FEMALE, "Stale");
        assertFalse(t.serializer(8).load(in));
        assertEquals(0, t.allocator.nextFreeIndex(FEMALE));
        assertEquals(-1, t.allocator.lookupIndex(FEMALE, "Athe"));
        assertEquals(-1, t.allocator.lookupIndex(FEMALE, "Stale"));
        assertEquals(0, t.registry.presetIndexOf(5));
    }

    @Test
    public void testNameAtLengthLimitSurvivesSaveAndLoad() {
        char[] longest = new char[PresetIndexAllocator.MAX_NAME_BYTES];
        Arrays.fill(longest, 'x');
        allocator.getOrAssignIndex(FEMALE, "Athena");
        allocator.getOrAssignIndex(FEMALE, new String(longest));
        try {
            allocator.getOrAssignIndex(FEMALE, new String(longest) + "y");
            fail("A name past the length limit must not be accepted");
        } catch (IllegalArgumentException expected) {
        }

        MemoryRecordStream saved = new MemoryRecordStream();
        assertTrue(serializer(4096).save(saved));

        Target t = new Target();
        assertTrue(t.serializer(4096).load(saved));
        assertEquals(0, t.allocator.lookupIndex(FEMALE, "Athena"));
        assertEquals(1, t.allocator.lookupIndex(FEMALE, new String(longest)));
        assertEquals(2, t.allocator.nextFreeIndex(FEMALE));
    }

    @Test
    public void testNegativeNameLengthIsRejected() {
        MemoryRecordStream in = new MemoryRecordStream()
                .addRecord(PRESET_INDEX_MAP_TYPE, 0, le(1, -8, 0, 0, 0));
        Target t = new Target();
        assertFalse(t.serializer(8).load(in));
        assertEquals(0, t.allocator.nextFreeIndex(FEMALE));
    }

    @Test
    public void testMissingTerminatorIsAFormatError() {
        byte[] noMaleSection = concat(le(1, 2, 0), new byte[] { 'A', 'b', 0, 0 }, le(0));
        MemoryRecordStream in = new MemoryRecordStream().addRecord(PRESET_INDEX_MAP_TYPE, 0, noMaleSection);
        Target t = new Target();
        assertFalse(t.serializer(8).load(in));
        assertEquals(-1, t.allocator.lookupIndex(FEMALE, "Ab"));
    }

    @Test
    public void testTrailingDataIsIgnored() {
        allocator.getOrAssignIndex(FEMALE, "Athena");
        MemoryRecordStream saved = new MemoryRecordStream();
        serializer(8).save(saved);

        MemoryRecordStream padded = new MemoryRecordStream()
                .addRecord(PRESET_INDEX_MAP_TYPE, 0, concat(saved.recordData(0), new byte[] { 9, 9, 9, 9, 9 }))
                .addRecord(ENTITY_REGISTRY_TYPE, 0, saved.recordData(1));
        Target t = new Target();
        assertTrue(t.serializer(8).load(padded));
        assertEquals(0, t.allocator.lookupIndex(FEMALE, "Athena"));
        assertEquals(0, t.allocator.lookupIndex(MALE, "Athena"));
    }

    @Test
    public void testUnknownAndDuplicateRecordsAreSkipped() {
        byte[] indexMap = concat(le(0, 0), le(0, 0));
        MemoryRecordStream in = new MemoryRecordStream()
                .addRecord(0x12345678, 0, new byte[] { 1, 2, 3 })
                .addRecord(ENTITY_REGISTRY_TYPE, 7, le(1, 1 << EntityState.PRESET_SHIFT))
                .addRecord(ENTITY_REGISTRY_TYPE, 0, le(2, 2 << EntityState.PRESET_SHIFT))
                .addRecord(ENTITY_REGISTRY_TYPE, 0, le(3, 3 << EntityState.PRESET_SHIFT))
                .addRecord(PRESET_INDEX_MAP_TYPE, 0, indexMap);

        Target t = new Target();
        assertTrue(t.serializer(8).load(in));
        assertFalse(t.registry.contains(1));
        assertEquals(1, t.registry.presetIndexOf(2));
        assertFalse(t.registry.contains(3));
    }

    @Test
    public void testWriteFailureOnlyAffectsItsRecord() {
        allocator.getOrAssignIndex(FEMALE, "Athena");
        registry.put(1, EntityState.ofPresetIndex(0));
        MemoryRecordStream delegate = new MemoryRecordStream();
        RecordStream failingRegistry = new RecordStream() {
            private int type;

            @Override
            public boolean openRecord(int type, int version) {
                this.type = type;
                return delegate.openRecord(type, version);
            }

            @Override
            public boolean writeChunk(byte[] data, int offset, int length) {
                return type != ENTITY_REGISTRY_TYPE && delegate.writeChunk(data, offset, length);
            }

            @Override
            public RecordInfo nextRecordInfo() {
                return delegate.nextRecordInfo();
            }

            @Override
            public int readChunk(byte[] buffer, int maxLength) {
                return delegate.readChunk(buffer, maxLength);
            }
        };

        assertFalse(serializer(8).save(failingRegistry));
        assertEquals(2, delegate.recordCount());
        // "Athena" takes 24 bytes per category; the registry record stays empty.
        assertEquals(48, delegate.recordData(0).length);
        assertEquals(0, delegate.recordData(1).length);
    }

    @Test
    public void testLoadReindexesStore() {
        allocator.getOrAssignIndex(FEMALE, "Aphrodite");
        allocator.getOrAssignIndex(FEMALE, "Athena");
        MemoryRecordStream saved = new MemoryRecordStream();
        serializer(8).save(saved);

        Target t = new Target();
        Preset athena = new Preset("Athena", "CBBE");
        Preset zeus = new Preset("Zeus", "CBBE");
        t.store.load(List.of(athena, zeus), Set.of());
        t.store.assignIndexes(t.allocator);
        assertEquals(0, athena.assignedIndex());

        assertTrue(t.serializer(8).load(saved.withReadChunkSize(3)));
        assertEquals(1, athena.assignedIndex());
        assertEquals(2, zeus.assignedIndex());
        assertSame(athena, t.store.getPreset(FEMALE, 1).orElseThrow());
        assertFalse(t.store.getPreset(FEMALE, 0).isPresent());
    }

    @Test
    public void testRevertClearsState() {
        Preset athena = new Preset("Athena", "CBBE");
        store.load(List.of(athena), Set.of());
        allocator.getOrAssignIndex(FEMALE, "Gone");
        store.assignIndexes(allocator);
        registry.put(1, EntityState.ofPresetIndex(1));

        serializer(8).revert();

        assertTrue(registry.isEmpty());
        assertEquals(-1, allocator.lookupIndex(FEMALE, "Gone"));
        assertEquals(0, athena.assignedIndex());
        assertSame(athena, store.getPreset(FEMALE, 0).orElseThrow());
    }

    @Test
    public void testBufferSizeValidation() {
        for (int bad : new int[] { 0, 4, 12, 65537 }) {
            try {
                serializer(bad);
                fail("Accepted buffer size " + bad);
            } catch (IllegalArgumentException expected) {
            }
        }
        assertEquals(StateSerializer.DEFAULT_BUFFER_SIZE, new StateSerializer(registry, allocator, store).bufferSize());
    }
}
