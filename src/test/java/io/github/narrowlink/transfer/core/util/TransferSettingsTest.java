package io.github.narrowlink.transfer.core.util;

import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransferSettingsTest {

    @Test
    void defaultsWhenNothingIsSet() {
        TransferSettings settings = TransferSettings.fromProperties(new Properties());
        assertEquals("0.0.0.0", settings.host());
        assertEquals(5000, settings.port());
        assertEquals(Path.of("./shared_files"), settings.storageRoot());
        assertEquals(EnumSet.allOf(ChunkSize.class), settings.allowedChunkSizes());
        assertEquals(ChunkSize.MEDIUM, settings.defaultChunkSize());
        assertEquals(CompressionLevel.MEDIUM, settings.compressionLevel());
        assertEquals(Duration.ofSeconds(30), settings.readTimeout());
        assertEquals(3, settings.retryAttempts());
        assertEquals(Duration.ofSeconds(1), settings.retryBackoff());
    }

    @Test
    void classpathDefaultsLoad() {
        TransferSettings settings = TransferSettings.load();
        assertEquals(5000, settings.port());
        assertTrue(settings.compressionAvailable());
    }

    @Test
    void parsesExplicitValues() {
        Properties props = new Properties();
        props.setProperty("server.port", "6000");
        props.setProperty("chunk.sizes", "1024, large");
        props.setProperty("chunk.default", "SMALL");
        props.setProperty("compression.level", "none");
        props.setProperty("timeout.read.seconds", "5");
        TransferSettings settings = TransferSettings.fromProperties(props);

        assertEquals(6000, settings.port());
        assertEquals(Set.of(ChunkSize.SMALL, ChunkSize.LARGE), settings.allowedChunkSizes());
        assertEquals(ChunkSize.SMALL, settings.defaultChunkSize());
        assertFalse(settings.compressionAvailable());
        assertEquals(Duration.ofSeconds(5), settings.readTimeout());
    }

    @Test
    void nonNumericValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("server.port", "abc");
        props.setProperty("retry.attempts", "");
        TransferSettings settings = TransferSettings.fromProperties(props);
        assertEquals(5000, settings.port());
        assertEquals(3, settings.retryAttempts());
    }

    @Test
    void unknownChunkSizeIsRejected() {
        Properties props = new Properties();
        props.setProperty("chunk.sizes", "1000");
        assertThrows(IllegalArgumentException.class, () -> TransferSettings.fromProperties(props));
    }

    @Test
    void defaultMustBeAllowed() {
        Properties props = new Properties();
        props.setProperty("chunk.sizes", "1024");
        props.setProperty("chunk.default", "4096");
        assertThrows(IllegalArgumentException.class, () -> TransferSettings.fromProperties(props));
    }

    @Test
    void requireAllowedChecksTheConfiguredSet() throws Exception {
        TransferSettings settings = TransferSettings.fromProperties(new Properties())
                .withChunkSizes(EnumSet.of(ChunkSize.MEDIUM), ChunkSize.MEDIUM);
        assertEquals(ChunkSize.MEDIUM, settings.requireAllowed(4096));
        assertEquals(ErrorKind.INVALID_CHUNK_SIZE,
                assertThrows(ProtocolException.class, () -> settings.requireAllowed(1024)).kind());
        assertEquals(ErrorKind.INVALID_CHUNK_SIZE,
                assertThrows(ProtocolException.class, () -> settings.requireAllowed(3000)).kind());
    }
}
