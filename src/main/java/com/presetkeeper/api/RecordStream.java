package com.presetkeeper.api;

/**
 * Record-oriented persisted stream supplied by the host.
 *
 * Writing: {@link #openRecord} starts a record; {@link #writeChunk} appends
 * bytes to it. Reading: {@link #nextRecordInfo} moves to the next record and
 * {@link #readChunk} returns that record's bytes in host-chosen chunk sizes,
 * then 0 once the record is exhausted.
 */
public interface RecordStream {

    /** Describes a record found while reading. */
    record RecordInfo(int type, int version, int length) {
    }

    /** @return false if the host could not open the record. */
    boolean openRecord(int type, int version);

    /** @return false if the host could not accept the bytes. */
    boolean writeChunk(byte[] data, int offset, int length);

    /** @return the next record, or null when there are no more. */
    RecordInfo nextRecordInfo();

    /**
     * Copies up to {@code maxLength} bytes of the current record into
     * {@code buffer}, starting at index 0.
     *
     * @return number of bytes copied; 0 at the end of the record.
     */
    int readChunk(byte[] buffer, int maxLength);
}
