package com.presetkeeper.io;

import com.presetkeeper.api.RecordStream;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link RecordStream}.
 *
 * Records are written first and read back afterwards. Reads are limited to
 * {@code readChunkSize} bytes per call so the codec can be run against hosts
 * that hand out data in small or odd-sized pieces.
 */
public final class MemoryRecordStream implements RecordStream {

    private static final class Record {
        final int type;
        final int version;
        final ByteArrayOutputStream data = new ByteArrayOutputStream();

        Record(int type, int version) {
            this.type = type;
            this.version = version;
        }
    }

    private final List<Record> records = new ArrayList<>();
    private final int readChunkSize;

    private Record writing;
    private int readCursor = -1;
    private byte[] reading = new byte[0];
    private int readOffset;

    public MemoryRecordStream() {
        this(Integer.MAX_VALUE);
    }

    /** @param readChunkSize Largest number of bytes returned by one {@link #readChunk} call. */
    public MemoryRecordStream(int readChunkSize) {
        if (readChunkSize < 1)
            throw new IllegalArgumentException("Read chunk size must be positive: " + readChunkSize);
        this.readChunkSize = readChunkSize;
    }

    /** Appends a complete record, as if written through {@link #openRecord} and {@link #writeChunk}. */
    public MemoryRecordStream addRecord(int type, int version, byte[] data) {
        Record r = new Record(type, version);
        r.data.write(data, 0, data.length);
        records.add(r);
        return this;
    }

    @Override
    public boolean openRecord(int type, int version) {
        writing = new Record(type, version);
        records.add(writing);
        return true;
    }

    @Override
    public boolean writeChunk(byte[] data, int offset, int length) {
        if (writing == null)
            return false;
        writing.data.write(data, offset, length);
        return true;
    }

    @Override
    public RecordInfo nextRecordInfo() {
        writing = null;
        if (readCursor + 1 >= records.size())
            return null;
        Record r = records.get(++readCursor);
        reading = r.data.toByteArray();
        readOffset = 0;
        return new RecordInfo(r.type, r.version, reading.length);
    }

    @Override
    public int readChunk(byte[] buffer, int maxLength) {
        int n = Math.min(Math.min(maxLength, readChunkSize), reading.length - readOffset);
        if (n <= 0)
            return 0;
        System.arraycopy(reading, readOffset, buffer, 0, n);
        readOffset += n;
        return n;
    }

    public int recordCount() {
        return records.size();
    }

    /** A copy of the data of record {@code i} in write order. */
    public byte[] recordData(int i) {
        return records.get(i).data.toByteArray();
    }

    public RecordInfo recordInfo(int i) {
        Record r = records.get(i);
        return new RecordInfo(r.type, r.version, r.data.size());
    }

    /** Copy of this stream whose reads are limited to {@code readChunkSize}. */
    public MemoryRecordStream withReadChunkSize(int readChunkSize) {
        MemoryRecordStream copy = new MemoryRecordStream(readChunkSize);
        for (Record r : records)
            copy.addRecord(r.type, r.version, r.data.toByteArray());
        return copy;
    }
}
