package io.github.narrowlink.transfer.core.storage;

import io.github.narrowlink.transfer.core.model.FileEntry;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.util.PathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Flat directory store. Uploads are staged under {@code <root>/.staging} and renamed into the root.
 */
public class LocalFileStore implements FileStore {
    private static final Logger log = LoggerFactory.getLogger(LocalFileStore.class);
    static final String STAGING_DIR = ".staging";

    private final Path root;
    private final Path staging;

    public LocalFileStore(Path root) throws IOException {
        this.root = root.toAbsolutePath().normalize();
        this.staging = this.root.resolve(STAGING_DIR);
        Files.createDirectories(this.staging);
        log.info("Serving files from {}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public FileChannel openForRead(String name) throws IOException {
        Path file = PathUtil.resolveWithin(root, name);
        if (!Files.isRegularFile(file)) {
            throw new ProtocolException(ErrorKind.FILE_NOT_FOUND, "File not found: " + name);
        }
        try {
            return FileChannel.open(file, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new ProtocolException(ErrorKind.FILE_NOT_FOUND, "File not found: " + name, e);
        }
    }

    @Override
    public StagedFile openForWriteTemp() throws IOException {
        return StagedFile.create(staging);
    }

    @Override
    public void commit(StagedFile staged, String name) throws IOException {
        Path target = PathUtil.resolveWithin(root, name);
        staged.commitTo(target);
        log.debug("Committed {} -> {}", staged.getTempFile(), target);
    }

    @Override
    public List<FileEntry> list() throws IOException {
        List<FileEntry> entries = new ArrayList<>();
        try (Stream<Path> files = Files.list(root)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                String name = file.getFileName().toString();
                if (!PathUtil.isValidFileName(name)) {
                    continue;
                }
                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(file, BasicFileAttributes.class);
                } catch (NoSuchFileException e) {
                    // removed between listing and stat
                    continue;
                }
                if (attrs.isRegularFile()) {
                    entries.add(new FileEntry(name, attrs.size(), attrs.lastModifiedTime().toMillis()));
                }
            }
        }
        entries.sort(Comparator.comparing(FileEntry::name));
        return entries;
    }
}
