package com.presetkeeper.core;

import com.presetkeeper.api.Preset;
import com.presetkeeper.api.PresetCategory;

import java.util.List;
import java.util.Locale;

/**
 * Decides which category a loaded preset belongs to, and which presets are
 * clothed variants that must not be distributed at all.
 *
 * Both checks are case-insensitive substring matches against marker lists.
 */
public final class PresetClassifier {

    public static final List<String> DEFAULT_MALE_STYLE_MARKERS = List.of("himbo", "talos", "sam", "sos", "savren");

    public static final List<String> DEFAULT_CLOTHED_MARKERS = List.of("cloth", "outfit", "nevernude", "bikini",
            "feet", "hands", "push", "cleavage", "armor");

    private final List<String> maleStyleMarkers;
    private final List<String> clothedMarkers;

    public PresetClassifier() {
        this(DEFAULT_MALE_STYLE_MARKERS, DEFAULT_CLOTHED_MARKERS);
    }

    public PresetClassifier(List<String> maleStyleMarkers, List<String> clothedMarkers) {
        this.maleStyleMarkers = lowerCase(maleStyleMarkers);
        this.clothedMarkers = lowerCase(clothedMarkers);
    }

    public PresetCategory categoryOf(Preset preset) {
        return containsAny(preset.styleTag(), maleStyleMarkers) ? PresetCategory.MALE : PresetCategory.FEMALE;
    }

    public boolean isClothedSet(String name) {
        return containsAny(name, clothedMarkers);
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (text == null || text.isEmpty())
            return false;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String m : markers)
            if (lower.contains(m))
                return true;
        return false;
    }

    private static List<String> lowerCase(List<String> markers) {
        return markers.stream().map(m -> m.toLowerCase(Locale.ROOT)).toList();
    }
}
