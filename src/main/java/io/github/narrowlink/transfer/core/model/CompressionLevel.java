package io.github.narrowlink.transfer.core.model;

/**
 * zlib levels offered for chunk compression.
 */
public enum CompressionLevel {
    NONE(0),
    LOW(1),
    MEDIUM(6),
    HIGH(9);

    private final int level;

    CompressionLevel(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
