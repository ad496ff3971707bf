package io.github.narrowlink.transfer.core.model;

import java.util.Objects;

public record FileEntry(String name, long size, long modifiedMillis) {
    public FileEntry {
        Objects.requireNonNull(name, "name");
    }
}
