package com.presetkeeper.io;

import com.presetkeeper.api.RecordStream;
import com.presetkeeper.api.RecordStream.RecordInfo;
import com.presetkeeper.core.EntityStateRegistry;
import com.presetkeeper.core.PresetIndexAllocator;
import com.presetkeeper.core.PresetStore;

import java.io.IOException;

import lombok.extern.log4j.Log4j2;

/**
 * Saves and restores the registry and the preset index tables as two records
 * of a host save stream.
 *
 * Failure Isolation:
 * Every record is handled on its own. A write failure or a malformed record is
 * logged at fatal level and leaves only that record's structure empty; the
 * other record is still written or read, and nothing is thrown to the host.
 *
 * Load Semantics:
 * {@link #load} starts from a clean state, as after {@link #revert()}. Records
 * of unknown type or version are skipped. Only the first record of each type is
 * read; later duplicates are reported and skipped. After loading, the preset
 * store's sparse arrays are rebuilt from the restored tables.
 */
@Log4j2
public final class StateSerializer {

    public static final int ENTITY_REGISTRY_TYPE = 0xA0B0D9EA;
    public static final int PRESET_INDEX_MAP_TYPE = 0xA0B0D9E0;
    public static final int ENTITY_REGISTRY_VERSION = 0;
    public static final int PRESET_INDEX_MAP_VERSION = 0;

    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;
    public static final int MIN_BUFFER_SIZE = 8;

    private final EntityStateRegistry registry;
    private final PresetIndexAllocator allocator;
    private final PresetStore store;
    private final EntityRegistryCodec registryCodec;
    private final PresetIndexMapCodec indexMapCodec;
    private final byte[] buffer;

    public StateSerializer(EntityStateRegistry registry, PresetIndexAllocator allocator, PresetStore store) {
        this(registry, allocator, store, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize Bytes buffered before a chunk is handed to the stream.
     *                   At least {@link #MIN_BUFFER_SIZE} and a multiple of 8.
     */
    public StateSerializer(EntityStateRegistry registry, PresetIndexAllocator allocator, PresetStore store,
            int bufferSize) {
        if (bufferSize < MIN_BUFFER_SIZE || bufferSize % 8 != 0)
            throw new IllegalArgumentException("Codec buffer size must be a multiple of 8 and at least "
                    + MIN_BUFFER_SIZE + ": " + bufferSize);
        this.registry = registry;
        this.allocator = allocator;
        this.store = store;
        this.registryCodec = new EntityRegistryCodec(registry);
        this.indexMapCodec = new PresetIndexMapCodec(allocator);
        this.buffer = new byte[bufferSize];
    }

    /**
     * Writes the preset index record, then the entity registry record.
     *
     * @return true if both records were written completely.
     */
    public synchronized boolean save(RecordStream out) {
        boolean ok = true;

        if (open(out, PRESET_INDEX_MAP_TYPE, PRESET_INDEX_MAP_VERSION, "preset index")) {
            try {
                indexMapCodec.encode(new ChunkedRecordWriter(out, buffer));
            } catch (IOException e) {
                log.fatal("Failed to save the preset index record", e);
                ok = false;
            }
        } else {
            ok = false;
        }

        if (open(out, ENTITY_REGISTRY_TYPE, ENTITY_REGISTRY_VERSION, "entity registry")) {
            try {
                int n = registryCodec.encode(new ChunkedRecordWriter(out, buffer));
                log.info("Saved {} entity states", n);
            } catch (IOException e) {
                log.fatal("Failed to save the entity registry record", e);
                ok = false;
            }
        } else {
            ok = false;
        }
        return ok;
    }

    private static boolean open(RecordStream out, int type, int version, String what) {
        if (out.openRecord(type, version))
            return true;
        log.fatal("Failed to open the {} record (type {}, version {})", what, hex(type), version);
        return false;
    }

    /**
     * Replaces the in-memory state with the records of {@code in}.
     *
     * @return true if every recognised record decoded cleanly and each was
     *         present.
     */
    public synchronized boolean load(RecordStream in) {
        clearState();

        boolean registryRead = false;
        boolean indexMapRead = false;
        boolean ok = true;

        RecordInfo info;
        while ((info = in.nextRecordInfo()) != null) {
            switch (info.type()) {
                case ENTITY_REGISTRY_TYPE -> {
                    if (registryRead) {
                        log.error("Skipping duplicate entity registry record");
                    } else if (info.version() != ENTITY_REGISTRY_VERSION) {
                        log.error("Skipping entity registry record of unknown version {}", info.version());
                    } else {
                        registryRead = true;
                        ok &= readEntityRegistry(in);
                    }
                }
                case PRESET_INDEX_MAP_TYPE -> {
                    if (indexMapRead) {
                        log.error("Skipping duplicate preset index record");
                    } else if (info.version() != PRESET_INDEX_MAP_VERSION) {
                        log.error("Skipping preset index record of unknown version {}", info.version());
                    } else {
                        indexMapRead = true;
                        ok &= readPresetIndexMap(in);
                    }
                }
                default -> log.error("Skipping record of unknown type {} (version {}, {} bytes)", hex(info.type()),
                        info.version(), info.length());
            }
        }

        if (!indexMapRead)
            log.warn("No preset index record found");
        if (!registryRead)
            log.warn("No entity registry record found");

        store.assignIndexes(allocator);
        log.info("Loaded {} entity states", registry.size());
        return ok && registryRead && indexMapRead;
    }

    private boolean readEntityRegistry(RecordStream in) {
        try {
            registryCodec.decode(new ChunkedRecordReader(in, buffer));
            return true;
        } catch (RecordFormatException e) {
            log.fatal("Failed to load the entity registry record: {}", e.getMessage());
            registry.clear();
            return false;
        }
    }

    private boolean readPresetIndexMap(RecordStream in) {
        try {
            indexMapCodec.decode(new ChunkedRecordReader(in, buffer));
            return true;
        } catch (RecordFormatException e) {
            log.fatal("Failed to load the preset index record: {}", e.getMessage());
            allocator.reset();
            return false;
        }
    }

    /** Drops all entity states and preset indexes, then re-indexes the loaded presets. */
    public synchronized void revert() {
        clearState();
        store.assignIndexes(allocator);
        log.debug("Reverted preset keeper state");
    }

    private void clearState() {
        registry.clear();
        allocator.reset();
    }

    private static String hex(int type) {
        return String.format("0x%08X", type);
    }

    public int bufferSize() {
        return buffer.length;
    }
}
