package io.github.narrowlink.transfer.core.storage;

import io.github.narrowlink.transfer.core.model.FileEntry;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.util.List;

/**
 * The file namespace served by one server. Implementations must be safe for concurrent use by
 * independent connections.
 */
public interface FileStore {

    /**
     * Opens the committed file for reading.
     *
     * @throws io.github.narrowlink.transfer.core.protocol.ProtocolException {@code FILE_NOT_FOUND}
     *         or {@code INVALID_FILENAME}
     */
    FileChannel openForRead(String name) throws IOException;

    StagedFile openForWriteTemp() throws IOException;

    /**
     * Atomically publishes a staged file under {@code name}.
     */
    void commit(StagedFile staged, String name) throws IOException;

    /**
     * Committed files, sorted by name.
     */
    List<FileEntry> list() throws IOException;
}
