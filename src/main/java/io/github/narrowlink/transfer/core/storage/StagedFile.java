package io.github.narrowlink.transfer.core.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * A private temporary file that receives chunks in order and is either moved into place
 * or discarded. Nothing is ever written under the final name until {@link #commitTo(Path)}.
 */
public class StagedFile implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StagedFile.class);
    private static final int MAX_MOVE_ATTEMPTS = 5;
    private static final long MOVE_RETRY_DELAY_MS = 100;

    private final Path tempFile;
    private final FileChannel channel;
    private long written;
    private boolean closed;
    private boolean finished;

    private StagedFile(Path tempFile) throws IOException {
        this.tempFile = tempFile;
        this.channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
    }

    /**
     * Creates the temp file in {@code directory}, which must be on the same file store as the target.
     */
    public static StagedFile create(Path directory) throws IOException {
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "incoming-", ".part");
        try {
            return new StagedFile(temp);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    public Path getTempFile() {
        return tempFile;
    }

    public long getWritten() {
        return written;
    }

    public void append(byte[] data) throws IOException {
        if (closed) {
            throw new IOException("Staged file already closed: " + tempFile);
        }
        ByteBuffer buffer = ByteBuffer.wrap(data);
        while (buffer.hasRemaining()) {
            written += channel.write(buffer, written);
        }
    }

    /**
     * Flushes and renames the temp file onto {@code target}, replacing any previous file atomically
     * where the file system allows it.
     */
    public void commitTo(Path target) throws IOException {
        if (finished) {
            throw new IOException("Staged file already finished: " + tempFile);
        }
        channel.force(true);
        closeChannel();
        for (int attempt = 1; ; attempt++) {
            try {
                move(target);
                finished = true;
                return;
            } catch (IOException e) {
                if (attempt == MAX_MOVE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Move attempt {} of {} -> {} failed, retrying", attempt, tempFile, target, e);
                try {
                    Thread.sleep(MOVE_RETRY_DELAY_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while committing " + target, ie);
                }
            }
        }
    }

    private void move(Path target) throws IOException {
        try {
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Drops the temp file; safe to call more than once and after a commit.
     */
    public void discard() {
        if (finished) {
            return;
        }
        finished = true;
        try {
            closeChannel();
        } catch (IOException e) {
            log.debug("Failed to close staged file {}", tempFile, e);
        }
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            log.warn("Failed to delete staged file {}", tempFile, e);
        }
    }

    private void closeChannel() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        channel.close();
    }

    @Override
    public void close() {
        discard();
    }
}
