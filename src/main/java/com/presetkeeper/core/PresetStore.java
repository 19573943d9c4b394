package com.presetkeeper.core;

import com.presetkeeper.api.Preset;
import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Dense storage of the loaded presets plus the sparse index lookup per
 * category.
 *
 * Per category the store keeps three lists: {@link PresetClass#NORMAL},
 * {@link PresetClass#EXCLUDED} and {@link PresetClass#ALL} (normal followed by
 * excluded). A preset's dense slot is its position in the ALL list; the
 * {@link SparsePresetIndex} maps a preset index to that slot.
 *
 * The lists are replaced wholesale by {@link #load}; readers always see one
 * consistent generation of them.
 */
public final class PresetStore {
    private static final Logger log = LogManager.getLogger(PresetStore.class);

    /** Counts of loaded presets, per category and classification. */
    public record PresetCounts(int female, int femaleExcluded, int male, int maleExcluded) {
    }

    private record Shelf(List<Preset> normal, List<Preset> excluded, List<Preset> all) {
        static final Shelf EMPTY = new Shelf(List.of(), List.of(), List.of());

        List<Preset> get(PresetClass presetClass) {
            return switch (presetClass) {
                case NORMAL -> normal;
                case EXCLUDED -> excluded;
                case ALL -> all;
            };
        }
    }

    private final PresetClassifier classifier;
    private final Random random;
    private final Map<PresetCategory, SparsePresetIndex> sparse = new EnumMap<>(PresetCategory.class);
    private final Map<PresetCategory, Shelf> shelves = new EnumMap<>(PresetCategory.class);

    public PresetStore(PresetClassifier classifier, Random random) {
        this.classifier = classifier;
        this.random = random;
        for (PresetCategory c : PresetCategory.values()) {
            sparse.put(c, new SparsePresetIndex());
            shelves.put(c, Shelf.EMPTY);
        }
    }

    public PresetStore() {
        this(new PresetClassifier(), new Random());
    }

    public SparsePresetIndex sparseIndex(PresetCategory category) {
        return sparse.get(category);
    }

    /**
     * Replaces the stored presets.
     *
     * Clothed sets and presets whose name exceeds
     * {@link PresetIndexAllocator#MAX_NAME_BYTES} are dropped. Every other preset
     * is filed under the category the classifier picks, and under EXCLUDED when
     * its name appears verbatim in
     * {@code excludedNames}. Indexes are not assigned here; call
     * {@link #assignIndexes} afterwards.
     */
    public void load(Collection<Preset> presets, Set<String> excludedNames) {
        Map<PresetCategory, List<Preset>> normal = new EnumMap<>(PresetCategory.class);
        Map<PresetCategory, List<Preset>> excluded = new EnumMap<>(PresetCategory.class);
        for (PresetCategory c : PresetCategory.values()) {
            normal.put(c, new ArrayList<>());
            excluded.put(c, new ArrayList<>());
        }

        int skipped = 0;
        for (Preset p : presets) {
            if (classifier.isClothedSet(p.name())) {
                skipped++;
                continue;
            }
            if (!PresetIndexAllocator.fitsNameLimit(p.name())) {
                log.warn("Skipped preset with a name longer than {} bytes", PresetIndexAllocator.MAX_NAME_BYTES);
                continue;
            }
            PresetCategory c = classifier.categoryOf(p);
            (excludedNames.contains(p.name()) ? excluded : normal).get(c).add(p);
        }

        synchronized (shelves) {
            for (PresetCategory c : PresetCategory.values()) {
                List<Preset> all = new ArrayList<>(normal.get(c));
                all.addAll(excluded.get(c));
                shelves.put(c, new Shelf(List.copyOf(normal.get(c)), List.copyOf(excluded.get(c)), List.copyOf(all)));
            }
        }

        PresetCounts counts = counts();
        log.info("Female presets: {}", counts.female());
        log.info("Male presets: {}", counts.male());
        log.info("Excluded from random selection: female presets: {}, male presets: {}",
                counts.femaleExcluded(), counts.maleExcluded());
        if (skipped > 0)
            log.info("Skipped {} clothed preset sets", skipped);
    }

    /**
     * Gives every stored preset its index and rebuilds the sparse arrays.
     *
     * Must run after {@link #load} and again whenever the allocator's tables
     * were restored or reset, since the sparse arrays are derived from them.
     */
    public void assignIndexes(PresetIndexAllocator allocator) {
        for (PresetCategory c : PresetCategory.values()) {
            SparsePresetIndex index = sparse.get(c);
            index.clear();
            index.ensureCapacity(allocator.nextFreeIndex(c));

            List<Preset> all = shelf(c).all();
            for (int slot = 0; slot < all.size(); slot++) {
                Preset p = all.get(slot);
                int presetIndex = allocator.getOrAssignIndex(c, p.name());
                p.assignIndex(presetIndex);
                index.set(presetIndex, slot);
            }
            log.debug("Indexed {} {} presets (next free index {})", all.size(), c, allocator.nextFreeIndex(c));
        }
    }

    /** Resolves a preset index; unoccupied or out-of-range indexes are not found. */
    public Optional<Preset> getPreset(PresetCategory category, int presetIndex) {
        int slot = sparse.get(category).denseSlot(presetIndex);
        if (slot == SparsePresetIndex.ABSENT)
            return Optional.empty();
        List<Preset> all = shelf(category).all();
        return slot < all.size() ? Optional.of(all.get(slot)) : Optional.empty();
    }

    /** Trimmed, case-insensitive exact-name lookup. */
    public Optional<Preset> findByName(PresetCategory category, PresetClass presetClass, String name) {
        if (name == null)
            return Optional.empty();
        for (Preset p : presets(category, presetClass))
            if (p.nameMatches(name))
                return Optional.of(p);
        return Optional.empty();
    }

    /** Uniform draw over the category's normal presets. */
    public Optional<Preset> randomPreset(PresetCategory category) {
        List<Preset> normal = shelf(category).normal();
        if (normal.isEmpty())
            return Optional.empty();
        return Optional.of(normal.get(random.nextInt(normal.size())));
    }

    /**
     * Draws one of {@code names} at random and returns the matching preset.
     *
     * A drawn name that matches nothing is removed and the draw repeated over
     * the remaining names. When no names are given, or none of them match, a
     * random normal preset is returned instead.
     */
    public Optional<Preset> randomPresetByName(PresetCategory category, PresetClass presetClass,
            List<String> names) {
        List<String> candidates = new ArrayList<>(names);
        if (candidates.isEmpty())
            log.debug("No preset names given for {}, choosing a random preset", category);

        while (!candidates.isEmpty()) {
            int pick = random.nextInt(candidates.size());
            Optional<Preset> found = findByName(category, presetClass, candidates.get(pick));
            if (found.isPresent())
                return found;
            log.debug("Preset '{}' not found for {}, {} candidates left", candidates.get(pick), category,
                    candidates.size() - 1);
            candidates.remove(pick);
        }
        return randomPreset(category);
    }

    public List<Preset> presets(PresetCategory category, PresetClass presetClass) {
        return shelf(category).get(presetClass);
    }

    /**
     * Pages through preset names in store order.
     */
    public List<String> presetNames(PresetCategory category, PresetClass presetClass, int offset, int limit) {
        if (offset < 0 || limit < 0)
            throw new IllegalArgumentException("offset and limit must not be negative");
        List<Preset> list = presets(category, presetClass);
        int end = (int) Math.min((long) offset + limit, list.size());
        List<String> names = new ArrayList<>(Math.max(0, end - offset));
        for (int i = offset; i < end; i++)
            names.add(list.get(i).name());
        return names;
    }

    public PresetCounts counts() {
        Shelf f = shelf(PresetCategory.FEMALE);
        Shelf m = shelf(PresetCategory.MALE);
        return new PresetCounts(f.normal().size(), f.excluded().size(), m.normal().size(), m.excluded().size());
    }

    private Shelf shelf(PresetCategory category) {
        synchronized (shelves) {
            return shelves.get(category);
        }
    }
}
