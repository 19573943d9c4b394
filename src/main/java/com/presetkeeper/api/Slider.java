package com.presetkeeper.api;

import java.util.Objects;

/**
 * A named numeric range applied by a preset. The bounds may be equal.
 */
public record Slider(String name, float min, float max) {

    public Slider {
        Objects.requireNonNull(name, "name");
    }

    public Slider(String name, float value) {
        this(name, value, value);
    }
}
