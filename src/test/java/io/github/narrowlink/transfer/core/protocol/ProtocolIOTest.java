package io.github.narrowlink.transfer.core.protocol;

import io.github.narrowlink.transfer.core.model.FileEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProtocolIOTest {

    private static byte[] digest(int seed) {
        byte[] digest = new byte[ProtocolIO.DIGEST_LENGTH];
        Arrays.fill(digest, (byte) seed);
        return digest;
    }

    @Test
    void headerCarriesVersionTypeAndPayloadLength() throws Exception {
        byte[] frame = ProtocolIO.toByteArray(new FileRequestMessage("a.txt"));
        assertEquals(ProtocolVersion.CURRENT, frame[0]);
        assertEquals(ProtocolMessageType.FILE_REQUEST.ordinal(), frame[1]);
        // u16 length + 5 bytes of name
        assertArrayEquals(new byte[]{0, 0, 0, 7}, Arrays.copyOfRange(frame, 2, 6));
        assertEquals(ProtocolIO.HEADER_LENGTH + 7, frame.length);
    }

    @Test
    void decodesEveryMessageType() throws Exception {
        List<ProtocolMessage> messages = List.of(
                new HandshakeMessage(1, 4096, true),
                new HandshakeAckMessage(1, 1024, false),
                new FileRequestMessage("report.pdf"),
                new FileMetadata("report.pdf", 5000, 4096, true, digest(7)),
                new FileChunkMessage(1, false, 3, new byte[]{1, 2, 3}),
                new ChunkAckMessage(42),
                new UploadStartMessage(),
                new UploadCompleteMessage("report.pdf", digest(9)),
                new ListRequestMessage(),
                new ListResponseMessage(List.of(new FileEntry("a", 1, 2), new FileEntry("b", 0, 3))),
                new ErrorMessage(ErrorKind.FILE_NOT_FOUND, "missing"));
        for (ProtocolMessage message : messages) {
            ProtocolMessage decoded = ProtocolIO.fromByteArray(ProtocolIO.toByteArray(message));
            assertEquals(message.type(), decoded.type());
            if (!(message instanceof FileChunkMessage)) {
                assertEquals(message, decoded, message.type().name());
            }
        }
    }

    @Test
    void chunkPayloadSurvivesEncoding() throws Exception {
        byte[] data = "hello chunk".getBytes(StandardCharsets.UTF_8);
        FileChunkMessage decoded = (FileChunkMessage) ProtocolIO.fromByteArray(
                ProtocolIO.toByteArray(new FileChunkMessage(7, false, data.length, data)));
        assertEquals(7, decoded.index());
        assertFalse(decoded.compressed());
        assertEquals(data.length, decoded.rawLength());
        assertArrayEquals(data, decoded.data());
    }

    @Test
    void unknownTypeIsMalformed() {
        byte[] frame = {1, (byte) 200, 0, 0, 0, 0};
        ProtocolException e = assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(frame));
        assertEquals(ErrorKind.MALFORMED_MESSAGE, e.kind());
    }

    @Test
    void foreignVersionHandshakeIsUnsupported() throws Exception {
        byte[] frame = ProtocolIO.toByteArray(new HandshakeMessage(1, 4096, false));
        frame[0] = 2;
        ProtocolException e = assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(frame));
        assertEquals(ErrorKind.VERSION_UNSUPPORTED, e.kind());
    }

    @Test
    void foreignVersionOnOtherMessagesIsMalformed() throws Exception {
        byte[] frame = ProtocolIO.toByteArray(new ListRequestMessage());
        frame[0] = 9;
        ProtocolException e = assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(frame));
        assertEquals(ErrorKind.MALFORMED_MESSAGE, e.kind());
    }

    @Test
    void lengthMismatchIsMalformed() throws Exception {
        byte[] frame = ProtocolIO.toByteArray(new FileRequestMessage("abc"));
        byte[] cut = Arrays.copyOf(frame, frame.length - 1);
        assertEquals(ErrorKind.MALFORMED_MESSAGE,
                assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(cut)).kind());
    }

    @Test
    void payloadShorterThanLayoutIsMalformed() throws Exception {
        // declares 2 payload bytes, HANDSHAKE needs 6
        byte[] frame = {1, 0, 0, 0, 0, 2, 1, 0};
        assertEquals(ErrorKind.MALFORMED_MESSAGE,
                assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(frame)).kind());
    }

    @Test
    void trailingPayloadBytesAreMalformed() throws Exception {
        byte[] frame = ProtocolIO.toByteArray(new ChunkAckMessage(3));
        byte[] padded = Arrays.copyOf(frame, frame.length + 1);
        padded[5] = (byte) (padded[5] + 1);
        assertEquals(ErrorKind.MALFORMED_MESSAGE,
                assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(padded)).kind());
    }

    @Test
    void unknownErrorCodeIsMalformed() {
        byte[] frame = {1, (byte) ProtocolMessageType.ERROR.ordinal(), 0, 0, 0, 3, 99, 0, 0};
        assertEquals(ErrorKind.MALFORMED_MESSAGE,
                assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(frame)).kind());
    }

    @Test
    void shortFrameIsMalformed() {
        assertEquals(ErrorKind.MALFORMED_MESSAGE,
                assertThrows(ProtocolException.class, () -> ProtocolIO.fromByteArray(new byte[]{1, 0})).kind());
    }
}
