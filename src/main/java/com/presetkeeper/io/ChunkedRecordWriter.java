package com.presetkeeper.io;

import com.presetkeeper.api.RecordStream;

import java.io.IOException;

/**
 * Buffers the data of one record and hands it to the host stream in chunks no
 * larger than the local buffer.
 *
 * Every value is little-endian. {@link #position()} counts bytes from the start
 * of the record, including bytes still buffered, and is what alignment is
 * measured against; where the buffer happens to be flushed has no effect on
 * the encoded bytes.
 */
public final class ChunkedRecordWriter {
    private final RecordStream out;
    private final byte[] buffer;
    private int offset;
    private long position;

    /**
     * @param out    Stream with an open record.
     * @param buffer Scratch buffer, at least 4 bytes. Reused across records.
     */
    public ChunkedRecordWriter(RecordStream out, byte[] buffer) {
        if (buffer.length < 4)
            throw new IllegalArgumentException("Record buffer must hold at least 4 bytes");
        this.out = out;
        this.buffer = buffer;
    }

    public void putInt(int value) throws IOException {
        if (buffer.length - offset < 4)
            flush();
        buffer[offset] = (byte) value;
        buffer[offset + 1] = (byte) (value >>> 8);
        buffer[offset + 2] = (byte) (value >>> 16);
        buffer[offset + 3] = (byte) (value >>> 24);
        offset += 4;
        position += 4;
    }

    /** Writes the bytes, spilling across as many flushes as needed. */
    public void putBytes(byte[] bytes) throws IOException {
        int written = 0;
        while (written < bytes.length) {
            if (offset == buffer.length)
                flush();
            int n = Math.min(buffer.length - offset, bytes.length - written);
            System.arraycopy(bytes, written, buffer, offset, n);
            offset += n;
            written += n;
            position += n;
        }
    }

    /** Pads with zero bytes until {@link #position()} is a multiple of {@code alignment} (a power of two). */
    public void alignTo(int alignment) throws IOException {
        int padding = (int) (-position & (alignment - 1));
        for (int i = 0; i < padding; i++) {
            if (offset == buffer.length)
                flush();
            buffer[offset++] = 0;
            position++;
        }
    }

    /** Hands buffered bytes to the stream. */
    public void flush() throws IOException {
        if (offset == 0)
            return;
        if (!out.writeChunk(buffer, 0, offset))
            throw new IOException("Failed to write " + offset + " bytes of record data");
        offset = 0;
    }

    public long position() {
        return position;
    }
}
