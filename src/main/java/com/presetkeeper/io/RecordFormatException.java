package com.presetkeeper.io;

import java.io.IOException;

/**
 * Persisted record data does not match its format.
 */
public class RecordFormatException extends IOException {

    public RecordFormatException(String message) {
        super(message);
    }
}
