package io.github.narrowlink.transfer.core.util;

import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Read-only configuration shared by all connections. Values are fixed for a connection's lifetime.
 */
public record TransferSettings(String host,
                               int port,
                               Path storageRoot,
                               Set<ChunkSize> allowedChunkSizes,
                               ChunkSize defaultChunkSize,
                               CompressionLevel compressionLevel,
                               Duration readTimeout,
                               Duration writeTimeout,
                               int retryAttempts,
                               Duration retryBackoff) {
    private static final Logger log = LoggerFactory.getLogger(TransferSettings.class);
    public static final String CLASSPATH_RESOURCE = "/narrowlink.properties";
    public static final String CONFIG_PROPERTY = "narrowlink.config";
    /** Largest frame accepted from a peer, header included. */
    public static final int MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    public TransferSettings {
        if (allowedChunkSizes == null || allowedChunkSizes.isEmpty()) {
            throw new IllegalArgumentException("At least one chunk size must be allowed");
        }
        allowedChunkSizes = Set.copyOf(allowedChunkSizes);
        if (!allowedChunkSizes.contains(defaultChunkSize)) {
            throw new IllegalArgumentException("Default chunk size " + defaultChunkSize + " is not allowed");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port " + port);
        }
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("Retry attempts must be at least 1");
        }
    }

    /**
     * Classpath defaults overlaid with the file named by {@code -Dnarrowlink.config}, if any.
     */
    public static TransferSettings load() {
        Properties props = new Properties();
        try (InputStream in = TransferSettings.class.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            log.warn("Failed to load {} from classpath", CLASSPATH_RESOURCE, e);
        }
        String external = System.getProperty(CONFIG_PROPERTY);
        if (external != null && !external.isBlank()) {
            loadFile(Path.of(external), props);
        }
        return fromProperties(props);
    }

    private static void loadFile(Path file, Properties props) {
        if (!Files.exists(file)) {
            log.warn("Configuration file {} does not exist, using defaults", file);
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load configuration from {}", file, e);
        }
    }

    public static TransferSettings fromProperties(Properties props) {
        String host = props.getProperty("server.host", "0.0.0.0").trim();
        int port = parseInt(props.getProperty("server.port"), 5000);
        Path root = Path.of(props.getProperty("storage.root", "./shared_files").trim());
        Set<ChunkSize> allowed = parseChunkSizes(props.getProperty("chunk.sizes"));
        ChunkSize defaultSize = parseChunkSize(props.getProperty("chunk.default", "4096"));
        CompressionLevel level = parseLevel(props.getProperty("compression.level", "MEDIUM"));
        Duration readTimeout = Duration.ofSeconds(parseInt(props.getProperty("timeout.read.seconds"), 30));
        Duration writeTimeout = Duration.ofSeconds(parseInt(props.getProperty("timeout.write.seconds"), 30));
        int attempts = parseInt(props.getProperty("retry.attempts"), 3);
        Duration backoff = Duration.ofMillis(parseInt(props.getProperty("retry.backoff.millis"), 1000));
        return new TransferSettings(host, port, root, allowed, defaultSize, level, readTimeout, writeTimeout,
                attempts, backoff);
    }

    /**
     * Resolves a chunk size from the wire against the allowed set.
     */
    public ChunkSize requireAllowed(long chunkSize) throws ProtocolException {
        ChunkSize size = ChunkSize.of(chunkSize);
        if (!allowedChunkSizes.contains(size)) {
            throw new ProtocolException(ErrorKind.INVALID_CHUNK_SIZE, "Chunk size " + chunkSize + " is not enabled");
        }
        return size;
    }

    public boolean compressionAvailable() {
        return compressionLevel != CompressionLevel.NONE;
    }

    public TransferSettings withPort(int newPort) {
        return new TransferSettings(host, newPort, storageRoot, allowedChunkSizes, defaultChunkSize,
                compressionLevel, readTimeout, writeTimeout, retryAttempts, retryBackoff);
    }

    public TransferSettings withStorageRoot(Path newRoot) {
        return new TransferSettings(host, port, newRoot, allowedChunkSizes, defaultChunkSize,
                compressionLevel, readTimeout, writeTimeout, retryAttempts, retryBackoff);
    }

    public TransferSettings withChunkSizes(Set<ChunkSize> allowed, ChunkSize defaultSize) {
        return new TransferSettings(host, port, storageRoot, allowed, defaultSize,
                compressionLevel, readTimeout, writeTimeout, retryAttempts, retryBackoff);
    }

    public TransferSettings withCompressionLevel(CompressionLevel level) {
        return new TransferSettings(host, port, storageRoot, allowedChunkSizes, defaultChunkSize,
                level, readTimeout, writeTimeout, retryAttempts, retryBackoff);
    }

    public TransferSettings withTimeouts(Duration read, Duration write) {
        return new TransferSettings(host, port, storageRoot, allowedChunkSizes, defaultChunkSize,
                compressionLevel, read, write, retryAttempts, retryBackoff);
    }

    public TransferSettings withRetry(int attempts, Duration backoff) {
        return new TransferSettings(host, port, storageRoot, allowedChunkSizes, defaultChunkSize,
                compressionLevel, readTimeout, writeTimeout, attempts, backoff);
    }

    private static Set<ChunkSize> parseChunkSizes(String text) {
        if (text == null || text.isBlank()) {
            return EnumSet.allOf(ChunkSize.class);
        }
        Set<ChunkSize> sizes = EnumSet.noneOf(ChunkSize.class);
        for (String part : text.split(",")) {
            if (!part.isBlank()) {
                sizes.add(parseChunkSize(part));
            }
        }
        return sizes;
    }

    private static ChunkSize parseChunkSize(String text) {
        String value = text.trim();
        try {
            return ChunkSize.of(Long.parseLong(value));
        } catch (NumberFormatException e) {
            return ChunkSize.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (ProtocolException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static CompressionLevel parseLevel(String text) {
        return CompressionLevel.valueOf(text.trim().toUpperCase(Locale.ROOT));
    }

    private static int parseInt(String text, int defaultValue) {
        if (text == null || text.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric setting '{}', using {}", text, defaultValue);
            return defaultValue;
        }
    }
}
