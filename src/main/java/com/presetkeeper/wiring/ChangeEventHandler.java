package com.presetkeeper.wiring;

/**
 * Consumes preset changes on the ring buffer's consumer thread.
 */
@FunctionalInterface
public interface ChangeEventHandler {
    /**
     * @param event      Reused slot; copy anything kept beyond this call.
     * @param endOfBatch True for the last change currently available.
     */
    void onChange(ChangeEvent event, boolean endOfBatch) throws Exception;
}
