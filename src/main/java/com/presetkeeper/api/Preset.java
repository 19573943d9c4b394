package com.presetkeeper.api;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named preset as produced by the preset source loader.
 *
 * <p>
 * Everything except the assigned index is fixed at construction. The index is
 * filled in lazily once the preset store has asked the allocator for it, and
 * stays {@link PresetIndex#UNASSIGNED} until then.
 */
public final class Preset {
    private final String name;
    private final String styleTag;
    private final Map<String, Slider> sliders;
    private volatile int assignedIndex = PresetIndex.UNASSIGNED;

    public Preset(String name, String styleTag, Collection<Slider> sliders) {
        this.name = Objects.requireNonNull(name, "name");
        this.styleTag = styleTag == null ? "" : styleTag;
        Map<String, Slider> byName = new LinkedHashMap<>();
        for (Slider s : sliders) {
            if (byName.putIfAbsent(s.name(), s) != null)
                throw new IllegalArgumentException("Duplicate slider '" + s.name() + "' in preset " + name);
        }
        this.sliders = Collections.unmodifiableMap(byName);
    }

    public Preset(String name, String styleTag) {
        this(name, styleTag, Collections.emptyList());
    }

    public String name() {
        return name;
    }

    public String styleTag() {
        return styleTag;
    }

    public Map<String, Slider> sliders() {
        return sliders;
    }

    public Slider slider(String sliderName) {
        return sliders.get(sliderName);
    }

    /** The preset's index within its category, or {@link PresetIndex#UNASSIGNED}. */
    public int assignedIndex() {
        return assignedIndex;
    }

    public boolean hasAssignedIndex() {
        return assignedIndex != PresetIndex.UNASSIGNED;
    }

    public void assignIndex(int index) {
        this.assignedIndex = PresetIndex.checkValid(index);
    }

    /** Case-insensitive comparison of the trimmed names. */
    public boolean nameMatches(String other) {
        return other != null && name.trim().equalsIgnoreCase(other.trim());
    }

    @Override
    public String toString() {
        return "Preset[" + name + ", " + styleTag + ", sliders=" + sliders.size() + ", index=" + assignedIndex + "]";
    }
}
