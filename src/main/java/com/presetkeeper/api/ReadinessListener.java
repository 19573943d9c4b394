package com.presetkeeper.api;

/**
 * Lifecycle callbacks telling API users when the keeper can be used.
 *
 * The keeper becomes ready once presets have been loaded and indexed. A
 * listener attached while the keeper is already ready receives
 * {@link #becomingReady()} and {@link #ready()} straight away.
 */
public interface ReadinessListener {

    default void becomingReady() {
    }

    void ready();

    default void becomingUnready() {
    }

    void noLongerReady();
}
