package io.github.narrowlink.transfer.core.protocol;

import io.github.narrowlink.transfer.core.service.ChecksumService;
import io.github.narrowlink.transfer.core.service.Chunker;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Describes one file before its chunks are sent. Created once per transfer by the sender.
 */
public final class FileMetadata implements ProtocolMessage {
    private final String name;
    private final long size;
    private final long chunkSize;
    private final boolean compressed;
    private final byte[] digest;

    public FileMetadata(String name, long size, long chunkSize, boolean compressed, byte[] digest) {
        this.name = Objects.requireNonNull(name, "name");
        if (size < 0) {
            throw new IllegalArgumentException("Negative size: " + size);
        }
        if (digest.length != ProtocolIO.DIGEST_LENGTH) {
            throw new IllegalArgumentException("Digest must be " + ProtocolIO.DIGEST_LENGTH + " bytes");
        }
        this.size = size;
        this.chunkSize = chunkSize;
        this.compressed = compressed;
        this.digest = digest.clone();
    }

    public String getName() {
        return name;
    }

    public long getSize() {
        return size;
    }

    public long getChunkSize() {
        return chunkSize;
    }

    public boolean isCompressed() {
        return compressed;
    }

    public byte[] getDigest() {
        return digest.clone();
    }

    public String getDigestHex() {
        return ChecksumService.toHex(digest);
    }

    /**
     * Number of FILE_CHUNK messages that follow; zero for an empty file.
     */
    public long chunkCount() {
        return Chunker.chunkCount(size, (int) chunkSize);
    }

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_METADATA;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, name);
        out.writeLong(size);
        ProtocolIO.writeUnsignedInt(out, chunkSize);
        out.writeBoolean(compressed);
        ProtocolIO.writeDigest(out, digest);
    }

    public static FileMetadata read(DataInputStream in) throws IOException {
        String name = ProtocolIO.readString(in);
        long size = in.readLong();
        long chunkSize = ProtocolIO.readUnsignedInt(in);
        boolean compressed = in.readBoolean();
        byte[] digest = ProtocolIO.readDigest(in);
        return new FileMetadata(name, size, chunkSize, compressed, digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FileMetadata other)) {
            return false;
        }
        return size == other.size && chunkSize == other.chunkSize && compressed == other.compressed
                && name.equals(other.name) && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, chunkSize, compressed, Arrays.hashCode(digest));
    }

    @Override
    public String toString() {
        return "FileMetadata[name=" + name + ", size=" + size + ", chunkSize=" + chunkSize
                + ", compressed=" + compressed + ", digest=" + getDigestHex() + "]";
    }
}
