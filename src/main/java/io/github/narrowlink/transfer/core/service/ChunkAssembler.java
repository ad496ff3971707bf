package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.TransferSession;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.FileChunkMessage;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.storage.StagedFile;

import java.io.IOException;

/**
 * Receiver side of a transfer: accepts chunks strictly in order, inflates them and appends the
 * raw bytes to a staged file. Nothing is buffered out of order.
 */
public class ChunkAssembler implements AutoCloseable {
    private final TransferSession session;
    private final StagedFile stagedFile;
    private final CompressionService compressionService;

    public ChunkAssembler(TransferSession session, StagedFile stagedFile, CompressionService compressionService) {
        this.session = session;
        this.stagedFile = stagedFile;
        this.compressionService = compressionService;
    }

    public TransferSession getSession() {
        return session;
    }

    public StagedFile getStagedFile() {
        return stagedFile;
    }

    public void accept(FileChunkMessage chunk) throws ProtocolException {
        FileMetadata metadata = session.getMetadata();
        if (session.isComplete()) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                    "Chunk " + chunk.index() + " after the last chunk of " + metadata.getName());
        }
        long expectedIndex = session.nextIndex();
        if (chunk.index() != expectedIndex) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                    "Expected chunk " + expectedIndex + " but got " + chunk.index());
        }
        int expectedLength = session.expectedLength(expectedIndex);
        if (chunk.rawLength() != expectedLength) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                    "Chunk " + chunk.index() + " has " + chunk.rawLength() + " bytes, expected " + expectedLength);
        }
        byte[] raw;
        if (chunk.compressed()) {
            if (!metadata.isCompressed()) {
                throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                        "Compressed chunk in an uncompressed transfer");
            }
            raw = compressionService.decompress(chunk.data(), chunk.rawLength());
        } else {
            if (chunk.data().length != chunk.rawLength()) {
                throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE,
                        "Chunk " + chunk.index() + " declares " + chunk.rawLength() + " bytes but carries "
                                + chunk.data().length);
            }
            raw = chunk.data();
        }
        try {
            stagedFile.append(raw);
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to write chunk " + chunk.index(), e);
        }
        session.record(raw);
    }

    public boolean isComplete() {
        return session.isComplete();
    }

    /**
     * Compares the digest of everything received with the one announced in the metadata.
     */
    public boolean verify() {
        return session.digestMatches();
    }

    @Override
    public void close() {
        stagedFile.discard();
    }
}
