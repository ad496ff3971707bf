package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CompressionServiceTest {
    private final CompressionService compressionService = new CompressionService();

    private static byte[] text(int repeats) {
        return "the quick brown fox jumps over the lazy dog. ".repeat(repeats).getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void roundTripAtEveryLevel() throws Exception {
        byte[] random = new byte[4096];
        new Random(5).nextBytes(random);
        for (CompressionLevel level : CompressionLevel.values()) {
            for (byte[] data : new byte[][]{new byte[0], text(100), random}) {
                byte[] packed = compressionService.compress(data, level);
                assertArrayEquals(data, compressionService.decompress(packed), level.name());
                assertArrayEquals(data, compressionService.decompress(packed, data.length), level.name());
            }
        }
    }

    @Test
    void repetitiveDataShrinks() {
        byte[] data = text(200);
        assertTrue(compressionService.compress(data, CompressionLevel.HIGH).length < data.length / 5);
    }

    @Test
    void garbageIsCorruptPayload() {
        byte[] garbage = {1, 2, 3, 4, 5, 6, 7, 8};
        ProtocolException e = assertThrows(ProtocolException.class, () -> compressionService.decompress(garbage));
        assertEquals(ErrorKind.CORRUPT_PAYLOAD, e.kind());
    }

    @Test
    void truncatedStreamIsCorruptPayload() {
        byte[] packed = compressionService.compress(text(50), CompressionLevel.MEDIUM);
        byte[] cut = Arrays.copyOf(packed, packed.length / 2);
        assertEquals(ErrorKind.CORRUPT_PAYLOAD,
                assertThrows(ProtocolException.class, () -> compressionService.decompress(cut)).kind());
    }

    @Test
    void wrongDeclaredLengthIsCorruptPayload() {
        byte[] data = text(10);
        byte[] packed = compressionService.compress(data, CompressionLevel.LOW);
        assertEquals(ErrorKind.CORRUPT_PAYLOAD, assertThrows(ProtocolException.class,
                () -> compressionService.decompress(packed, data.length - 1)).kind());
        assertEquals(ErrorKind.CORRUPT_PAYLOAD, assertThrows(ProtocolException.class,
                () -> compressionService.decompress(packed, data.length + 1)).kind());
    }
}
