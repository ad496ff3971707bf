package io.github.narrowlink.transfer.core.protocol;

/**
 * Message types; the ordinal is the type byte on the wire, so only append new constants.
 */
public enum ProtocolMessageType {
    HANDSHAKE,
    HANDSHAKE_ACK,
    FILE_REQUEST,
    FILE_METADATA,
    FILE_CHUNK,
    CHUNK_ACK,
    UPLOAD_START,
    UPLOAD_COMPLETE,
    LIST_REQUEST,
    LIST_RESPONSE,
    ERROR;

    private static final ProtocolMessageType[] VALUES = values();

    public static ProtocolMessageType fromCode(int code) throws ProtocolException {
        if (code < 0 || code >= VALUES.length) {
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE, "Unknown message type " + code);
        }
        return VALUES[code];
    }
}
