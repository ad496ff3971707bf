package io.github.narrowlink.transfer.core.model;

import java.util.Arrays;

/**
 * A contiguous slice of a file: bytes {@code [index * chunkSize, index * chunkSize + data.length)}.
 */
public record Chunk(int index, byte[] data) {
    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("Negative chunk index " + index);
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Chunk other && index == other.index && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * index + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Chunk[index=" + index + ", length=" + data.length + "]";
    }
}
