package com.psyos.pipeline.infrastructure;

import java.util.Arrays;

/**
 * Unwrapped conversation data key, scoped to one request or job.
 * Closing it zeroes the key bytes.
 */
public final class DataKey implements AutoCloseable {

    private final byte[] key;
    private boolean closed;

    DataKey(byte[] key) {
        this.key = key;
    }

    byte[] bytes() {
        if (closed) {
            throw new IllegalStateException("Data key already closed");
        }
        return key;
    }

    @Override
    public void close() {
        Arrays.fill(key, (byte) 0);
        closed = true;
    }
}
