package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.model.TransferSession;
import io.github.narrowlink.transfer.core.protocol.FileChunkMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.NoSuchElementException;

/**
 * Sender side of a transfer: reads chunks in order from an open file and turns them into
 * FILE_CHUNK messages, compressing a chunk only when that makes it smaller.
 */
public class ChunkSource implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChunkSource.class);

    private final FileChannel channel;
    private final TransferSession session;
    private final CompressionService compressionService;
    private final CompressionLevel level;
    private volatile boolean closed;

    public ChunkSource(FileChannel channel, TransferSession session, CompressionService compressionService,
                       CompressionLevel level) {
        this.channel = channel;
        this.session = session;
        this.compressionService = compressionService;
        this.level = level;
    }

    public TransferSession getSession() {
        return session;
    }

    public boolean hasNext() {
        return !closed && !session.isComplete();
    }

    public boolean isExhausted() {
        return session.isComplete();
    }

    public long chunkCount() {
        return session.getMetadata().chunkCount();
    }

    public FileChunkMessage next() throws IOException {
        if (!hasNext()) {
            throw new NoSuchElementException("No chunk left for " + session.getMetadata().getName());
        }
        long index = session.nextIndex();
        byte[] raw = Chunker.readChunk(channel, session.getMetadata().getSize(),
                session.getChunkSize().bytes(), index);
        session.record(raw);
        if (session.getMetadata().isCompressed()) {
            byte[] packed = compressionService.compress(raw, level);
            if (packed.length < raw.length) {
                return new FileChunkMessage(index, true, raw.length, packed);
            }
        }
        return new FileChunkMessage(index, false, raw.length, raw);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close source for {}", session.getMetadata().getName(), e);
        }
    }
}
