package io.github.narrowlink.transfer.core.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumServiceTest {
    private final ChecksumService checksumService = new ChecksumService();

    @Test
    void knownSha256Vectors() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                ChecksumService.toHex(checksumService.digest(new byte[0])));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                ChecksumService.toHex(checksumService.digest("abc".getBytes(StandardCharsets.US_ASCII))));
    }

    @Test
    void digestIsDeterministic() {
        byte[] data = new byte[5000];
        new Random(1).nextBytes(data);
        assertArrayEquals(checksumService.digest(data), checksumService.digest(data.clone()));
    }

    @Test
    void singleBitFlipChangesDigest() {
        byte[] data = new byte[5000];
        new Random(2).nextBytes(data);
        byte[] original = checksumService.digest(data);
        data[4321] ^= 0x01;
        assertFalse(Arrays.equals(original, checksumService.digest(data)));
    }

    @Test
    void fileAndChannelDigestsMatchInMemoryDigest(@TempDir Path dir) throws Exception {
        byte[] data = new byte[70_000];
        new Random(3).nextBytes(data);
        Path file = dir.resolve("f.bin");
        Files.write(file, data);

        byte[] expected = checksumService.digest(data);
        assertArrayEquals(expected, checksumService.digest(file));
        try (FileChannel channel = FileChannel.open(file)) {
            assertArrayEquals(expected, checksumService.digest(channel, data.length));
        }
    }
}
