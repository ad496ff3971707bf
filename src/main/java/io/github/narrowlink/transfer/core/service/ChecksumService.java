package io.github.narrowlink.transfer.core.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Whole-file SHA-256 digests.
 */
public class ChecksumService {
    private static final int BUFFER_SIZE = 8192;

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public byte[] digest(byte[] data) {
        return newDigest().digest(data);
    }

    public byte[] digest(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest md = newDigest();
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
            return md.digest();
        }
    }

    /**
     * Digests the first {@code size} bytes of an open channel with positional reads.
     */
    public byte[] digest(FileChannel channel, long size) throws IOException {
        MessageDigest md = newDigest();
        ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);
        long position = 0;
        while (position < size) {
            buffer.clear();
            if (size - position < buffer.capacity()) {
                buffer.limit((int) (size - position));
            }
            int read = channel.read(buffer, position);
            if (read < 0) {
                throw new IOException("File shrank while computing digest");
            }
            buffer.flip();
            md.update(buffer);
            position += read;
        }
        return md.digest();
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
