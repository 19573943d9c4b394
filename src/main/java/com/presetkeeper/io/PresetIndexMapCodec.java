package com.presetkeeper.io;

import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.core.PresetIndexAllocator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Encodes the preset name to index tables of the allocator.
 *
 * Layout (little-endian, offsets relative to the record start):
 * For each category in declaration order ({@code FEMALE} then {@code MALE}):
 * <pre>
 *   u32 nextFreeIndex
 *   repeated, each entry starting at a 4-byte aligned offset:
 *     u32 nameLength   (greater than zero)
 *     u32 presetIndex  (below nextFreeIndex)
 *     nameLength bytes of UTF-8, zero padded to the next 4-byte boundary
 *   u32 0              (end of category)
 * </pre>
 * Anything after the second category is reported and ignored.
 */
final class PresetIndexMapCodec {
    private static final Logger log = LogManager.getLogger(PresetIndexMapCodec.class);

    static final int ALIGNMENT = 4;

    /** Upper bound on an encoded name; longer lengths are treated as corruption. */
    static final int MAX_NAME_BYTES = PresetIndexAllocator.MAX_NAME_BYTES;

    private final PresetIndexAllocator allocator;

    PresetIndexMapCodec(PresetIndexAllocator allocator) {
        this.allocator = allocator;
    }

    void encode(ChunkedRecordWriter out) throws IOException {
        for (PresetCategory category : PresetCategory.values()) {
            PresetIndexAllocator.TableSnapshot table = allocator.snapshot(category);
            out.putInt(table.nextFreeIndex());
            for (Map.Entry<String, Integer> e : table.indexByName().entrySet()) {
                byte[] name = e.getKey().getBytes(StandardCharsets.UTF_8);
                out.putInt(name.length);
                out.putInt(e.getValue());
                out.putBytes(name);
                out.alignTo(ALIGNMENT);
            }
            out.putInt(0);
            log.debug("Wrote {} preset indexes for {}", table.indexByName().size(), category);
        }
        out.flush();
    }

    /**
     * Reads both tables and installs them in the allocator. The allocator is
     * not touched when the record is malformed.
     *
     * @throws RecordFormatException on a truncated header or entry, a bad name
     *                               length, an index at or above the header's
     *                               counter, or a name listed twice.
     */
    void decode(ChunkedRecordReader in) throws RecordFormatException {
        Map<PresetCategory, Map<String, Integer>> tables = new EnumMap<>(PresetCategory.class);
        Map<PresetCategory, Integer> counters = new EnumMap<>(PresetCategory.class);

        for (PresetCategory category : PresetCategory.values()) {
            int nextFree = in.readInt(category + " preset index header");
            if (nextFree < 0 || nextFree > PresetIndexAllocator.CAPACITY)
                throw new RecordFormatException("Invalid next free index " + Integer.toUnsignedString(nextFree)
                        + " for " + category);

            Map<String, Integer> table = new HashMap<>();
            while (true) {
                int length = in.readInt(category + " preset name length");
                if (length == 0)
                    break;
                if (length < 0 || length > MAX_NAME_BYTES)
                    throw new RecordFormatException("Invalid preset name length " + Integer.toUnsignedString(length)
                            + " at offset " + (in.position() - 4));
                int index = in.readInt(category + " preset index");
                if (index < 0 || index >= nextFree)
                    throw new RecordFormatException("Invalid preset index " + Integer.toUnsignedString(index)
                            + " for " + category + " (next free index " + nextFree + ")");
                String name = new String(in.readBytes(length, category + " preset name"), StandardCharsets.UTF_8);
                in.skipToAlignment(ALIGNMENT, category + " preset name padding");
                if (table.put(name, index) != null)
                    throw new RecordFormatException("Preset '" + name + "' listed twice for " + category);
            }
            tables.put(category, table);
            counters.put(category, nextFree);
        }

        long trailing = in.skipRemaining();
        if (trailing > 0)
            log.error("Ignoring {} bytes of trailing data in the preset index record", trailing);

        for (PresetCategory category : PresetCategory.values())
            allocator.restore(category, tables.get(category), counters.get(category));
        log.debug("Read preset indexes: {} female, {} male", tables.get(PresetCategory.FEMALE).size(),
                tables.get(PresetCategory.MALE).size());
    }
}
