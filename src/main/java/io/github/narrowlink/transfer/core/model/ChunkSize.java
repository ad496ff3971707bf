package io.github.narrowlink.transfer.core.model;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;

/**
 * The only chunk sizes a transfer may use.
 */
public enum ChunkSize {
    /** Ultra-low bandwidth links. */
    SMALL(1024),
    MEDIUM(4096),
    LARGE(16384),
    XLARGE(65536);

    private final int bytes;

    ChunkSize(int bytes) {
        this.bytes = bytes;
    }

    public int bytes() {
        return bytes;
    }

    public static ChunkSize of(long bytes) throws ProtocolException {
        for (ChunkSize size : values()) {
            if (size.bytes == bytes) {
                return size;
            }
        }
        throw new ProtocolException(ErrorKind.INVALID_CHUNK_SIZE, "Chunk size " + bytes + " is not allowed");
    }
}
