package com.presetkeeper;

import com.presetkeeper.api.EntityChangeListener;
import com.presetkeeper.api.EntityState;
import com.presetkeeper.api.Preset;
import com.presetkeeper.api.PresetCategory;
import com.presetkeeper.api.PresetChange;
import com.presetkeeper.api.PresetChangeFlags;
import com.presetkeeper.api.PresetClass;
import com.presetkeeper.api.PresetNameLookup;
import com.presetkeeper.api.ReadinessListener;
import com.presetkeeper.api.RecordStream;
import com.presetkeeper.config.ConfigLoader;
import com.presetkeeper.config.KeeperConfig;
import com.presetkeeper.core.EntityEventDispatcher;
import com.presetkeeper.core.EntityStateRegistry;
import com.presetkeeper.core.PresetClassifier;
import com.presetkeeper.core.PresetIndexAllocator;
import com.presetkeeper.core.PresetStore;
import com.presetkeeper.io.FileRecordStream;
import com.presetkeeper.io.StateSerializer;
import com.presetkeeper.util.CompositeReadinessListener;
import com.presetkeeper.wiring.ChangeEventHandler;
import com.presetkeeper.wiring.RingBufferChangeListener;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point that wires the preset store, the index allocator, the entity
 * registry, the change dispatcher and the save codec together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading presets and assigning their indexes</li>
 * <li>Binding presets to entities, by name or at random</li>
 * <li>Notifying change and readiness listeners</li>
 * <li>Saving to and restoring from a record stream or a file</li>
 * </ul>
 * All methods are safe to call from multiple threads.
 */
public class PresetKeeper {
    private static final Logger log = LogManager.getLogger(PresetKeeper.class);

    private final KeeperConfig config;
    private final PresetStore store;
    private final PresetIndexAllocator allocator;
    private final EntityStateRegistry registry;
    private final EntityEventDispatcher<EntityChangeListener> changeDispatcher;
    private final CompositeReadinessListener readiness = new CompositeReadinessListener();
    private final StateSerializer serializer;
    private final PresetNameLookup nameLookup;

    private volatile boolean ready;

    public PresetKeeper(KeeperConfig config) {
        this(config, ConfigLoader.nameLookup(config), new Random());
    }

    /**
     * @param config     Settings.
     * @param nameLookup Names offered to {@link #assignRandomPreset}.
     * @param random     Source for random preset selection.
     */
    public PresetKeeper(KeeperConfig config, PresetNameLookup nameLookup, Random random) {
        this.config = config;
        this.nameLookup = nameLookup;
        this.store = new PresetStore(new PresetClassifier(), random);
        this.allocator = new PresetIndexAllocator(store);
        this.registry = new EntityStateRegistry(config.getRegistryStripes());
        this.changeDispatcher = new EntityEventDispatcher<>(registry);
        this.serializer = new StateSerializer(registry, allocator, store, config.getCodecBufferSize());
    }

    /** Creates a keeper from a JSON configuration file. */
    public static PresetKeeper fromConfigFile(Path path) throws IOException {
        return new PresetKeeper(ConfigLoader.load(path));
    }

    /**
     * Replaces the loaded presets and indexes them.
     *
     * Readiness listeners are told the keeper is going away first if it was
     * ready, and that it is ready once indexing is done.
     */
    public synchronized void loadPresets(Collection<Preset> presets) {
        if (ready) {
            ready = false;
            readiness.becomingUnready();
            readiness.noLongerReady();
        }
        store.load(presets, new HashSet<>(config.getBlacklistedPresetsFromRandomDistribution()));
        store.assignIndexes(allocator);
        ready = true;
        readiness.becomingReady();
        readiness.ready();
    }

    public boolean isReady() {
        return ready;
    }

    /**
     * Binds the named preset to the entity and notifies change listeners.
     *
     * A null or blank name clears the entity's preset instead.
     *
     * @param owner Who made the change; passed through to listeners.
     * @return false if no preset of that name exists in the category.
     */
    public boolean assignPreset(int entityId, PresetCategory category, String name, String owner) {
        if (name == null || name.isBlank())
            return clearPreset(entityId, category, owner);
        Optional<Preset> preset = store.findByName(category, PresetClass.ALL, name);
        if (preset.isEmpty()) {
            log.warn("No {} preset named '{}' for entity {}", category, name, Integer.toHexString(entityId));
            return false;
        }
        bind(entityId, category, preset.get(), owner, PresetChangeFlags.NONE);
        return true;
    }

    /**
     * Binds a random preset, drawn from the names configured for the entity or
     * from all normal presets of the category when none are configured.
     *
     * @return the chosen preset, empty if the category has none.
     */
    public Optional<Preset> assignRandomPreset(int entityId, PresetCategory category, String owner) {
        List<String> names = nameLookup.presetNamesFor(entityId, category);
        Optional<Preset> preset = store.randomPresetByName(category, PresetClass.ALL, names);
        if (preset.isEmpty()) {
            log.warn("No {} presets available for entity {}", category, Integer.toHexString(entityId));
            return preset;
        }
        bind(entityId, category, preset.get(), owner, PresetChangeFlags.RANDOMLY_SELECTED);
        return preset;
    }

    private void bind(int entityId, PresetCategory category, Preset preset, String owner, long flags) {
        int index = preset.hasAssignedIndex() ? preset.assignedIndex()
                : allocator.getOrAssignIndex(category, preset.name());
        registry.emplaceOrVisit(entityId, EntityState.EMPTY, s -> s.withPresetIndex(index));
        log.debug("Entity {} assigned {} preset '{}' (index {}) by {}", Integer.toHexString(entityId), category,
                preset.name(), index, owner);
        changeDispatcher.dispatch(entityId,
                () -> new PresetChange(owner, category, preset.name(), flags),
                EntityChangeListener::onPresetChanged);
    }

    /**
     * Removes the entity's preset and notifies listeners with the previous
     * preset's name, or an empty name when that preset is no longer loaded.
     *
     * @return false if the entity had no preset.
     */
    public boolean clearPreset(int entityId, PresetCategory category, String owner) {
        final int[] previous = { -1 };
        registry.visit(entityId, s -> {
            previous[0] = s.presetIndex();
            return s.withoutPreset();
        });
        if (previous[0] < 0)
            return false;

        final int oldIndex = previous[0];
        changeDispatcher.dispatch(entityId,
                () -> new PresetChange(owner, category,
                        store.getPreset(category, oldIndex).map(Preset::name).orElse(""),
                        PresetChangeFlags.PRESET_WAS_UNASSIGNED),
                EntityChangeListener::onPresetChanged);
        return true;
    }

    /** The preset bound to the entity, resolved in {@code category}. */
    public Optional<Preset> assignedPreset(int entityId, PresetCategory category) {
        int index = registry.presetIndexOf(entityId);
        return index < 0 ? Optional.empty() : store.getPreset(category, index);
    }

    public Optional<String> assignedPresetName(int entityId, PresetCategory category) {
        return assignedPreset(entityId, category).map(Preset::name);
    }

    /** @return false if the listener was already attached. */
    public boolean attach(EntityChangeListener listener) {
        return changeDispatcher.attach(listener);
    }

    public boolean detach(EntityChangeListener listener) {
        return changeDispatcher.detach(listener);
    }

    /**
     * Attaches a listener whose handler runs on a ring buffer consumer thread
     * sized by {@code ringBufferSize}. Detach and close the returned listener
     * to stop it.
     */
    public RingBufferChangeListener attachAsync(ChangeEventHandler handler) {
        RingBufferChangeListener listener = new RingBufferChangeListener(config.getRingBufferSize(), handler);
        changeDispatcher.attach(listener);
        return listener;
    }

    public boolean isAttached(EntityChangeListener listener) {
        return changeDispatcher.isAttached(listener);
    }

    /**
     * Registers a readiness listener. If the keeper is already ready the
     * listener is told so immediately.
     */
    public synchronized boolean attach(ReadinessListener listener) {
        if (!readiness.addForComposite(listener))
            return false;
        if (ready) {
            listener.becomingReady();
            listener.ready();
        }
        return true;
    }

    public synchronized boolean detach(ReadinessListener listener) {
        return readiness.removeFromComposite(listener);
    }

    public boolean save(RecordStream out) {
        return serializer.save(out);
    }

    public boolean load(RecordStream in) {
        return serializer.load(in);
    }

    public void revert() {
        serializer.revert();
    }

    /** Saves to a local file, replacing it. */
    public boolean saveTo(Path path) throws IOException {
        try (FileRecordStream out = FileRecordStream.create(path)) {
            return serializer.save(out);
        }
    }

    public boolean loadFrom(Path path) throws IOException {
        try (FileRecordStream in = FileRecordStream.open(path)) {
            return serializer.load(in);
        }
    }

    public PresetStore.PresetCounts presetCounts() {
        return store.counts();
    }

    public List<String> presetNames(PresetCategory category, PresetClass presetClass, int offset, int limit) {
        return store.presetNames(category, presetClass, offset, limit);
    }

    public EntityStateRegistry getRegistry() {
        return registry;
    }
}
