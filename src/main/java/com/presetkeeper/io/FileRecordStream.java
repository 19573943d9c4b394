package com.presetkeeper.io;

import com.presetkeeper.api.RecordStream;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * {@link RecordStream} over a local file.
 *
 * File Layout (little-endian):
 * A sequence of records, each a 12-byte header {@code (type u32, version u32,
 * length u32)} followed by {@code length} data bytes. While writing, the
 * length of the open record is patched in when the next record is opened or
 * the stream is closed.
 *
 * A file truncated inside a record header ends the stream; a file truncated
 * inside record data yields the bytes that are present and the codec reports
 * the short record. Read errors are logged and treated the same way.
 */
public final class FileRecordStream implements RecordStream, Closeable {
    private static final Logger log = LogManager.getLogger(FileRecordStream.class);

    static final int HEADER_SIZE = 12;

    private final FileChannel channel;
    private final boolean writable;
    private final Path path;
    private final ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE).order(ByteOrder.LITTLE_ENDIAN);

    // Writing: file position of the open record's header, -1 if none.
    private long openHeaderPosition = -1;
    private long openLength;

    // Reading: position and remaining length of the current record's data.
    private long dataPosition;
    private long dataRemaining;
    private long nextHeaderPosition;

    private FileRecordStream(Path path, FileChannel channel, boolean writable) {
        this.path = path;
        this.channel = channel;
        this.writable = writable;
    }

    /** Creates or truncates {@code path} for writing. */
    public static FileRecordStream create(Path path) throws IOException {
        FileChannel ch = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING);
        return new FileRecordStream(path, ch, true);
    }

    /** Opens an existing file for reading. */
    public static FileRecordStream open(Path path) throws IOException {
        return new FileRecordStream(path, FileChannel.open(path, StandardOpenOption.READ), false);
    }

    @Override
    public boolean openRecord(int type, int version) {
        if (!writable)
            return false;
        try {
            finishRecord();
            openHeaderPosition = channel.position();
            openLength = 0;
            header.clear();
            header.putInt(type).putInt(version).putInt(0).flip();
            writeFully(header);
            return true;
        } catch (IOException e) {
            log.error("Failed to start record in {}", path, e);
            openHeaderPosition = -1;
            return false;
        }
    }

    @Override
    public boolean writeChunk(byte[] data, int offset, int length) {
        if (!writable || openHeaderPosition < 0)
            return false;
        if (openLength + length > 0xFFFFFFFFL) {
            log.error("Record in {} exceeds the 4 GiB limit", path);
            return false;
        }
        try {
            writeFully(ByteBuffer.wrap(data, offset, length));
            openLength += length;
            return true;
        } catch (IOException e) {
            log.error("Failed to write {} bytes to {}", length, path, e);
            return false;
        }
    }

    @Override
    public RecordInfo nextRecordInfo() {
        if (writable)
            return null;
        try {
            header.clear();
            int n = channel.read(header, nextHeaderPosition);
            if (n < HEADER_SIZE) {
                if (n > 0)
                    log.error("Ignoring {} bytes of truncated record header at the end of {}", n, path);
                return null;
            }
            header.flip();
            int type = header.getInt();
            int version = header.getInt();
            int length = header.getInt();
            dataPosition = nextHeaderPosition + HEADER_SIZE;
            dataRemaining = Integer.toUnsignedLong(length);
            nextHeaderPosition = dataPosition + dataRemaining;
            return new RecordInfo(type, version, length);
        } catch (IOException e) {
            log.error("Failed to read record header from {}", path, e);
            return null;
        }
    }

    @Override
    public int readChunk(byte[] buffer, int maxLength) {
        if (writable || dataRemaining <= 0)
            return 0;
        int want = (int) Math.min(Math.min(maxLength, buffer.length), dataRemaining);
        try {
            int n = channel.read(ByteBuffer.wrap(buffer, 0, want), dataPosition);
            if (n <= 0) {
                dataRemaining = 0;
                return 0;
            }
            dataPosition += n;
            dataRemaining -= n;
            return n;
        } catch (IOException e) {
            log.error("Failed to read record data from {}", path, e);
            dataRemaining = 0;
            return 0;
        }
    }

    private void finishRecord() throws IOException {
        if (openHeaderPosition < 0)
            return;
        ByteBuffer len = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
        len.putInt((int) openLength).flip();
        while (len.hasRemaining())
            channel.write(len, openHeaderPosition + 8 + len.position());
        openHeaderPosition = -1;
    }

    private void writeFully(ByteBuffer b) throws IOException {
        while (b.hasRemaining())
            channel.write(b);
    }

    @Override
    public void close() throws IOException {
        try {
            if (writable)
                finishRecord();
        } finally {
            channel.close();
        }
    }
}
