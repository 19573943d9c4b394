package com.presetkeeper.core;

import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetIndex;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import lombok.extern.log4j.Log4j2;

/**
 * Hands out stable preset indexes per category.
 *
 * Allocation Scheme:
 * Each category keeps an append-only name-to-index table and a next-free-index
 * counter. The first time a name is seen it receives the counter's value and
 * the counter advances; the mapping is never changed or removed afterwards
 * (except by {@link #reset()} or {@link #restore}). The table is persisted with
 * the save, which is what keeps indexes stable across save/load cycles even
 * when presets are installed or removed in between.
 *
 * Symmetric Reservation:
 * A new name is also registered in the opposite category (table and sparse
 * array only, never its dense store). Index spaces therefore advance in step
 * across categories, so an entity whose category classification flips after it
 * was assigned a preset never resolves to an unrelated preset.
 *
 * Locking:
 * One read-write lock covers both categories. Lookups share the read lock;
 * allocation is rare and takes the write lock, which it needs anyway because
 * it touches both tables.
 */
@Log4j2
public final class PresetIndexAllocator {

    /**
     * Highest count of indexes per category. One below {@link PresetIndex#LIMIT}
     * because an entity stores index + 1 in a 20-bit slot.
     */
    public static final int CAPACITY = PresetIndex.LIMIT - 1;

    /** Longest accepted name, in UTF-8 bytes. The saved table is read back under the same bound. */
    public static final int MAX_NAME_BYTES = 1 << 16;

    private static final class Table {
        final Map<String, Integer> indexByName = new HashMap<>();
        int nextFreeIndex;
    }

    private final PresetStore store;
    private final Map<PresetCategory, Table> tables = new EnumMap<>(PresetCategory.class);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public PresetIndexAllocator(PresetStore store) {
        this.store = store;
        for (PresetCategory c : PresetCategory.values())
            tables.put(c, new Table());
    }

    /**
     * Returns the index of {@code name} in {@code category}, assigning the next
     * free one if the name has never been seen.
     *
     * @throws IllegalArgumentException if the name is null, empty or longer
     *                                  than {@link #MAX_NAME_BYTES}.
     * @throws IllegalStateException    if the index space of either category
     *                                  is exhausted; nothing is registered then.
     */
    public int getOrAssignIndex(PresetCategory category, String name) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Preset name must not be empty");
        if (!fitsNameLimit(name))
            throw new IllegalArgumentException("Preset name longer than " + MAX_NAME_BYTES + " bytes: "
                    + name.substring(0, 32) + "...");
        lock.readLock().lock();
        try {
            Integer existing = tables.get(category).indexByName.get(name);
            if (existing != null)
                return existing;
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            Table table = tables.get(category);
            Integer existing = table.indexByName.get(name);
            if (existing != null)
                return existing;

            PresetCategory mirror = category.opposite();
            Table mirrorTable = tables.get(mirror);
            boolean reserve = !mirrorTable.indexByName.containsKey(name);
            checkCapacity(category, table, name);
            if (reserve)
                checkCapacity(mirror, mirrorTable, name);

            int index = allocate(category, table, name);
            if (reserve)
                allocate(mirror, mirrorTable, name);

            return index;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** True if the name's UTF-8 encoding is at most {@link #MAX_NAME_BYTES} long. */
    public static boolean fitsNameLimit(String name) {
        // A UTF-16 char never takes more than three UTF-8 bytes.
        return name.length() * 3 <= MAX_NAME_BYTES || name.getBytes(StandardCharsets.UTF_8).length <= MAX_NAME_BYTES;
    }

    private static void checkCapacity(PresetCategory category, Table table, String name) {
        if (table.nextFreeIndex >= CAPACITY)
            throw new IllegalStateException("Preset index space exhausted for " + category + " while assigning " + name);
    }

    private int allocate(PresetCategory category, Table table, String name) {
        int index = table.nextFreeIndex++;
        table.indexByName.put(name, index);
        store.sparseIndex(category).ensureCapacity(table.nextFreeIndex);
        log.debug("Assigned preset index {} to '{}' ({})", index, name, category);
        return index;
    }

    /** Returns the index of {@code name}, or {@link PresetIndex#UNASSIGNED}, without allocating. */
    public int lookupIndex(PresetCategory category, String name) {
        lock.readLock().lock();
        try {
            Integer existing = tables.get(category).indexByName.get(name);
            return existing != null ? existing : PresetIndex.UNASSIGNED;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int nextFreeIndex(PresetCategory category) {
        lock.readLock().lock();
        try {
            return tables.get(category).nextFreeIndex;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size(PresetCategory category) {
        lock.readLock().lock();
        try {
            return tables.get(category).indexByName.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** A consistent copy of one category's table. */
    public record TableSnapshot(int nextFreeIndex, Map<String, Integer> indexByName) {
    }

    /**
     * Returns a copy of the category's counter and name-to-index table, taken
     * under one lock acquisition. The table is ordered by index.
     */
    public TableSnapshot snapshot(PresetCategory category) {
        List<Map.Entry<String, Integer>> entries;
        int nextFree;
        lock.readLock().lock();
        try {
            Table table = tables.get(category);
            entries = new ArrayList<>(table.indexByName.entrySet());
            nextFree = table.nextFreeIndex;
        } finally {
            lock.readLock().unlock();
        }
        entries.sort(Map.Entry.comparingByValue());
        Map<String, Integer> ordered = new LinkedHashMap<>(entries.size() * 2);
        for (Map.Entry<String, Integer> e : entries)
            ordered.put(e.getKey(), e.getValue());
        return new TableSnapshot(nextFree, Collections.unmodifiableMap(ordered));
    }

    /**
     * Replaces a category's table with persisted content.
     *
     * @throws IllegalArgumentException if an index is not below
     *                                  {@code nextFreeIndex}, or the counter is
     *                                  out of range.
     */
    public void restore(PresetCategory category, Map<String, Integer> indexByName, int nextFreeIndex) {
        if (nextFreeIndex < 0 || nextFreeIndex > CAPACITY)
            throw new IllegalArgumentException("Next free preset index out of range: " + nextFreeIndex);
        for (Map.Entry<String, Integer> e : indexByName.entrySet()) {
            int index = e.getValue();
            if (index < 0 || index >= nextFreeIndex)
                throw new IllegalArgumentException("Preset '" + e.getKey() + "' has index " + index
                        + " beyond the next free index " + nextFreeIndex);
        }

        lock.writeLock().lock();
        try {
            Table table = tables.get(category);
            table.indexByName.clear();
            table.indexByName.putAll(indexByName);
            table.nextFreeIndex = nextFreeIndex;
            store.sparseIndex(category).ensureCapacity(nextFreeIndex);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Restored {} preset indexes for {} (next free {})", indexByName.size(), category, nextFreeIndex);
    }

    /** Forgets every assignment in both categories. */
    public void reset() {
        lock.writeLock().lock();
        try {
            for (Table t : tables.values()) {
                t.indexByName.clear();
                t.nextFreeIndex = 0;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }
}
