package io.github.narrowlink.transfer.core.model;

import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.service.ChecksumService;
import io.github.narrowlink.transfer.core.service.Chunker;

import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bookkeeping for one file transfer on one connection: how many chunks have gone through
 * and the digest of their raw bytes so far. Not thread-safe; owned by a single state machine.
 */
public class TransferSession {
    private final FileMetadata metadata;
    private final ChunkSize chunkSize;
    private final MessageDigest digest = ChecksumService.newDigest();
    private final Instant createdAt = Instant.now();
    private long chunksTransferred;
    private long bytesTransferred;
    private byte[] finalDigest;

    public TransferSession(FileMetadata metadata, ChunkSize chunkSize) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.chunkSize = Objects.requireNonNull(chunkSize, "chunkSize");
        if (metadata.getChunkSize() != chunkSize.bytes()) {
            throw new IllegalArgumentException("Metadata chunk size " + metadata.getChunkSize()
                    + " does not match " + chunkSize);
        }
    }

    public FileMetadata getMetadata() {
        return metadata;
    }

    public ChunkSize getChunkSize() {
        return chunkSize;
    }

    public long nextIndex() {
        return chunksTransferred;
    }

    public long getChunksTransferred() {
        return chunksTransferred;
    }

    public long getBytesTransferred() {
        return bytesTransferred;
    }

    public boolean isComplete() {
        return chunksTransferred >= metadata.chunkCount();
    }

    /**
     * Raw length chunk {@code index} must have for this file.
     */
    public int expectedLength(long index) {
        return Chunker.chunkLength(metadata.getSize(), chunkSize.bytes(), index);
    }

    /**
     * Accounts for the next chunk's raw bytes, in order.
     */
    public void record(byte[] raw) {
        if (finalDigest != null) {
            throw new IllegalStateException("Session digest already finished");
        }
        digest.update(raw);
        chunksTransferred++;
        bytesTransferred += raw.length;
    }

    public byte[] computedDigest() {
        if (finalDigest == null) {
            finalDigest = digest.digest();
        }
        return finalDigest.clone();
    }

    public boolean digestMatches() {
        return MessageDigest.isEqual(computedDigest(), metadata.getDigest());
    }

    public Duration getDuration() {
        return Duration.between(createdAt, Instant.now());
    }
}
