package io.github.narrowlink.transfer.core.protocol;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Byte layout of a single message: {@code [version u8][type u8][length u32]} followed by
 * exactly {@code length} payload bytes, all in network byte order.
 */
public final class ProtocolIO {
    public static final int HEADER_LENGTH = 6;
    public static final int LENGTH_FIELD_OFFSET = 2;
    public static final int LENGTH_FIELD_LENGTH = 4;
    public static final int DIGEST_LENGTH = 32;
    private static final int MAX_STRING_BYTES = 0xFFFF;

    private ProtocolIO() {
    }

    public static void writeString(DataOutputStream out, String value) throws IOException {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_BYTES) {
            throw new IOException("String too long");
        }
        out.writeShort(bytes.length);
        out.write(bytes);
    }

    public static String readString(DataInputStream in) throws IOException {
        int len = in.readUnsignedShort();
        byte[] bytes = in.readNBytes(len);
        if (bytes.length != len) {
            throw new EOFException("String truncated");
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public static void writeUnsignedInt(DataOutputStream out, long value) throws IOException {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IOException("Value out of u32 range: " + value);
        }
        out.writeInt((int) value);
    }

    public static long readUnsignedInt(DataInputStream in) throws IOException {
        return in.readInt() & 0xFFFFFFFFL;
    }

    public static void writeDigest(DataOutputStream out, byte[] digest) throws IOException {
        if (digest.length != DIGEST_LENGTH) {
            throw new IOException("Digest must be " + DIGEST_LENGTH + " bytes");
        }
        out.write(digest);
    }

    public static byte[] readDigest(DataInputStream in) throws IOException {
        byte[] digest = new byte[DIGEST_LENGTH];
        in.readFully(digest);
        return digest;
    }

    public static byte[] toByteArray(ProtocolMessage message) throws IOException {
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(payload)) {
            message.write(out);
        }
        ByteArrayOutputStream frame = new ByteArrayOutputStream(HEADER_LENGTH + payload.size());
        try (DataOutputStream out = new DataOutputStream(frame)) {
            out.writeByte(ProtocolVersion.CURRENT);
            out.writeByte(message.type().ordinal());
            out.writeInt(payload.size());
            payload.writeTo(out);
        }
        return frame.toByteArray();
    }

    /**
     * Decodes one complete frame, header included.
     *
     * @throws ProtocolException {@code VERSION_UNSUPPORTED} for a HANDSHAKE with a foreign version,
     *                           {@code MALFORMED_MESSAGE} for anything that does not match its layout
     */
    public static ProtocolMessage fromByteArray(byte[] frame) throws ProtocolException {
        if (frame.length < HEADER_LENGTH) {
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE, "Frame shorter than header");
        }
        int version = frame[0] & 0xFF;
        ProtocolMessageType type = ProtocolMessageType.fromCode(frame[1] & 0xFF);
        if (!ProtocolVersion.isSupported(version)) {
            if (type == ProtocolMessageType.HANDSHAKE) {
                throw new ProtocolException(ErrorKind.VERSION_UNSUPPORTED,
                        "Protocol version " + version + " is not supported");
            }
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE,
                    "Unexpected protocol version " + version + " on " + type);
        }
        long length = ((frame[2] & 0xFFL) << 24) | ((frame[3] & 0xFFL) << 16)
                | ((frame[4] & 0xFFL) << 8) | (frame[5] & 0xFFL);
        if (length != frame.length - HEADER_LENGTH) {
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE,
                    "Declared length " + length + " but payload has " + (frame.length - HEADER_LENGTH) + " bytes");
        }
        try (DataInputStream in = new DataInputStream(
                new ByteArrayInputStream(frame, HEADER_LENGTH, frame.length - HEADER_LENGTH))) {
            ProtocolMessage message = switch (type) {
                case HANDSHAKE -> HandshakeMessage.read(in);
                case HANDSHAKE_ACK -> HandshakeAckMessage.read(in);
                case FILE_REQUEST -> FileRequestMessage.read(in);
                case FILE_METADATA -> FileMetadata.read(in);
                case FILE_CHUNK -> FileChunkMessage.read(in);
                case CHUNK_ACK -> ChunkAckMessage.read(in);
                case UPLOAD_START -> UploadStartMessage.read(in);
                case UPLOAD_COMPLETE -> UploadCompleteMessage.read(in);
                case LIST_REQUEST -> ListRequestMessage.read(in);
                case LIST_RESPONSE -> ListResponseMessage.read(in);
                case ERROR -> ErrorMessage.read(in);
            };
            if (in.available() > 0) {
                throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE,
                        in.available() + " trailing bytes after " + type + " payload");
            }
            return message;
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE, "Malformed " + type + " payload", e);
        }
    }
}
