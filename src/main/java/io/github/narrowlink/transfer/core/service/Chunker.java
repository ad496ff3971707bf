package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.Chunk;
import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits file bytes into fixed-size chunks and joins them back. Chunk {@code i} always covers
 * {@code [i * size, min((i + 1) * size, total))}.
 */
public final class Chunker {
    /** Chunk indices travel as u32. */
    public static final long MAX_CHUNK_COUNT = 0xFFFFFFFFL;

    private Chunker() {
    }

    public static long chunkCount(long totalSize, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        return totalSize / chunkSize + (totalSize % chunkSize == 0 ? 0 : 1);
    }

    public static int chunkLength(long totalSize, int chunkSize, long index) {
        long count = chunkCount(totalSize, chunkSize);
        if (index < 0 || index >= count) {
            throw new IllegalArgumentException("Chunk index " + index + " outside 0.." + (count - 1));
        }
        long start = index * chunkSize;
        return (int) Math.min(chunkSize, totalSize - start);
    }

    public static List<Chunk> split(byte[] data, int chunkSize) throws ProtocolException {
        return split(data, ChunkSize.of(chunkSize));
    }

    public static List<Chunk> split(byte[] data, ChunkSize chunkSize) {
        int size = chunkSize.bytes();
        List<Chunk> chunks = new ArrayList<>((int) chunkCount(data.length, size));
        for (int offset = 0, index = 0; offset < data.length; offset += size, index++) {
            int end = Math.min(offset + size, data.length);
            chunks.add(new Chunk(index, Arrays.copyOfRange(data, offset, end)));
        }
        return chunks;
    }

    /**
     * Reassembles chunks presented in increasing index order.
     *
     * @throws ProtocolException {@code OUT_OF_ORDER} when indices are not strictly increasing,
     *                           {@code MISSING_CHUNK} when an index in {@code 0..n-1} is absent
     */
    public static byte[] join(List<Chunk> chunks) throws ProtocolException {
        int previous = -1;
        for (Chunk chunk : chunks) {
            if (chunk.index() <= previous) {
                throw new ProtocolException(ErrorKind.OUT_OF_ORDER,
                        "Chunk " + chunk.index() + " presented after chunk " + previous);
            }
            previous = chunk.index();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int expected = 0;
        for (Chunk chunk : chunks) {
            if (chunk.index() != expected) {
                throw new ProtocolException(ErrorKind.MISSING_CHUNK, "Chunk " + expected + " is missing");
            }
            out.writeBytes(chunk.data());
            expected++;
        }
        return out.toByteArray();
    }

    /**
     * Positional read of chunk {@code index}; the channel position is left untouched.
     */
    public static byte[] readChunk(FileChannel channel, long totalSize, int chunkSize, long index) throws IOException {
        int length = chunkLength(totalSize, chunkSize, index);
        long offset = index * chunkSize;
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, offset + buffer.position());
            if (read < 0) {
                throw new EOFException("File shrank while reading chunk " + index);
            }
        }
        return buffer.array();
    }
}
