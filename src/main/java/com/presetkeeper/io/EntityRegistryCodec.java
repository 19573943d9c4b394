package com.presetkeeper.io;

import com.presetkeeper.api.EntityState;
import com.presetkeeper.core.EntityStateRegistry;

import java.io.IOException;
import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Encodes the entity registry record.
 *
 * Layout (little-endian):
 * A flat run of 8-byte tuples {@code (entityId u32, state u32)}. There is no
 * count and no terminator; the record ends where the data ends. Only the bits
 * in {@link EntityState#PERSISTED_MASK} are written, and they are masked again
 * on decode so a corrupt record cannot set transient bits.
 */
final class EntityRegistryCodec {
    private static final Logger log = LogManager.getLogger(EntityRegistryCodec.class);

    private final EntityStateRegistry registry;

    EntityRegistryCodec(EntityStateRegistry registry) {
        this.registry = registry;
    }

    /** @return number of entities written. */
    int encode(ChunkedRecordWriter out) throws IOException {
        // forEachWhile cannot propagate a checked exception; park it and stop.
        final IOException[] failure = new IOException[1];
        final int[] written = new int[1];
        registry.forEachWhile((entityId, state) -> {
            try {
                out.putInt(entityId);
                out.putInt(state.persisted().bits());
                written[0]++;
                return true;
            } catch (IOException e) {
                failure[0] = e;
                return false;
            }
        });
        if (failure[0] != null)
            throw failure[0];
        out.flush();
        log.debug("Wrote {} entity states", written[0]);
        return written[0];
    }

    /**
     * Reads every tuple, then inserts them into the registry. Nothing is
     * inserted when the record is malformed.
     *
     * @return number of entities restored.
     * @throws RecordFormatException if the record ends inside a tuple.
     */
    int decode(ChunkedRecordReader in) throws RecordFormatException {
        int[] ids = new int[64];
        int[] states = new int[64];
        int n = 0;
        while (in.hasMore()) {
            if (n == ids.length) {
                ids = Arrays.copyOf(ids, n << 1);
                states = Arrays.copyOf(states, n << 1);
            }
            ids[n] = in.readInt("entity id");
            states[n] = in.readInt("entity state") & EntityState.PERSISTED_MASK;
            n++;
        }
        for (int i = 0; i < n; i++)
            registry.put(ids[i], new EntityState(states[i]));
        log.debug("Read {} entity states", n);
        return n;
    }
}
