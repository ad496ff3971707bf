package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib compression of individual chunk payloads.
 */
public class CompressionService {
    private static final int BUFFER_SIZE = 8192;

    public byte[] compress(byte[] data, CompressionLevel level) {
        Deflater deflater = new Deflater(level.level());
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    public byte[] decompress(byte[] data) throws ProtocolException {
        return inflate(data, Integer.MAX_VALUE);
    }

    /**
     * Inflates a chunk whose raw length is known from its header.
     *
     * @throws ProtocolException {@code CORRUPT_PAYLOAD} if the stream is malformed or not exactly that long
     */
    public byte[] decompress(byte[] data, int expectedLength) throws ProtocolException {
        byte[] out = inflate(data, expectedLength);
        if (out.length != expectedLength) {
            throw new ProtocolException(ErrorKind.CORRUPT_PAYLOAD,
                    "Inflated " + out.length + " bytes, expected " + expectedLength);
        }
        return out;
    }

    private byte[] inflate(byte[] data, int maxLength) throws ProtocolException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new ProtocolException(ErrorKind.CORRUPT_PAYLOAD, "Compressed payload is incomplete");
                }
                out.write(buffer, 0, n);
                if (out.size() > maxLength) {
                    throw new ProtocolException(ErrorKind.CORRUPT_PAYLOAD,
                            "Compressed payload inflates beyond " + maxLength + " bytes");
                }
            }
            if (inflater.getRemaining() > 0) {
                throw new ProtocolException(ErrorKind.CORRUPT_PAYLOAD, "Trailing bytes after compressed payload");
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new ProtocolException(ErrorKind.CORRUPT_PAYLOAD, "Malformed compressed payload", e);
        } finally {
            inflater.end();
        }
    }
}
