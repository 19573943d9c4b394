package com.presetkeeper.io;

import com.presetkeeper.api.RecordStream;

/**
 * Reads one record's data through a local buffer, refilling it from the host
 * stream as it drains.
 *
 * The host may return chunks of any size, so every read may straddle a refill:
 * a 4-byte field can be split across two chunks just like a name. The record
 * ends at the first zero-length read. {@link #position()} counts bytes consumed
 * since the start of the record.
 */
public final class ChunkedRecordReader {
    private final RecordStream in;
    private final byte[] buffer;
    private int offset;
    private int limit;
    private long position;
    private boolean endOfRecord;

    public ChunkedRecordReader(RecordStream in, byte[] buffer) {
        if (buffer.length == 0)
            throw new IllegalArgumentException("Record buffer must not be empty");
        this.in = in;
        this.buffer = buffer;
    }

    /** @return true if at least one more byte can be read. */
    public boolean hasMore() {
        return fill();
    }

    /**
     * @param what Field name for the error message.
     * @throws RecordFormatException if the record ends inside the field.
     */
    public int readInt(String what) throws RecordFormatException {
        if (limit - offset >= 4) {
            int v = (buffer[offset] & 0xFF)
                    | (buffer[offset + 1] & 0xFF) << 8
                    | (buffer[offset + 2] & 0xFF) << 16
                    | (buffer[offset + 3] & 0xFF) << 24;
            offset += 4;
            position += 4;
            return v;
        }
        int v = 0;
        for (int shift = 0; shift < 32; shift += 8) {
            if (!fill())
                throw truncated(what);
            v |= (buffer[offset++] & 0xFF) << shift;
            position++;
        }
        return v;
    }

    /** Reads exactly {@code length} bytes, across refills if needed. */
    public byte[] readBytes(int length, String what) throws RecordFormatException {
        byte[] out = new byte[length];
        int read = 0;
        while (read < length) {
            if (!fill())
                throw truncated(what);
            int n = Math.min(limit - offset, length - read);
            System.arraycopy(buffer, offset, out, read, n);
            offset += n;
            read += n;
            position += n;
        }
        return out;
    }

    /** Skips padding up to the next multiple of {@code alignment} (a power of two). */
    public void skipToAlignment(int alignment, String what) throws RecordFormatException {
        int padding = (int) (-position & (alignment - 1));
        for (int i = 0; i < padding; i++) {
            if (!fill())
                throw truncated(what);
            offset++;
            position++;
        }
    }

    /** Consumes the rest of the record. Returns the number of bytes skipped. */
    public long skipRemaining() {
        long skipped = 0;
        while (fill()) {
            skipped += limit - offset;
            position += limit - offset;
            offset = limit;
        }
        return skipped;
    }

    public long position() {
        return position;
    }

    private boolean fill() {
        if (offset < limit)
            return true;
        if (endOfRecord)
            return false;
        int n = in.readChunk(buffer, buffer.length);
        if (n <= 0) {
            endOfRecord = true;
            return false;
        }
        offset = 0;
        limit = Math.min(n, buffer.length);
        return true;
    }

    private RecordFormatException truncated(String what) {
        return new RecordFormatException("Record ended inside " + what + " at offset " + position);
    }
}
