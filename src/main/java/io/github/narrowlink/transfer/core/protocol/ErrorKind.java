package io.github.narrowlink.transfer.core.protocol;

/**
 * Error kinds carried by ERROR messages. The code is the byte written on the wire.
 */
public enum ErrorKind {
    VERSION_UNSUPPORTED(1, false),
    MALFORMED_MESSAGE(2, false),
    TRUNCATED(3, true),
    INVALID_CHUNK_SIZE(4, false),
    INVALID_FILENAME(5, false),
    FILE_NOT_FOUND(6, false),
    MISSING_CHUNK(7, false),
    OUT_OF_ORDER(8, false),
    CORRUPT_PAYLOAD(9, true),
    CHECKSUM_MISMATCH(10, true),
    WRITE_ERROR(11, true),
    PROTOCOL_VIOLATION(12, false),
    TIMEOUT(13, true);

    private final int code;
    private final boolean retryable;

    ErrorKind(int code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public int code() {
        return code;
    }

    /**
     * Whether restarting the whole transfer on a fresh connection may succeed.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public static ErrorKind fromCode(int code) throws ProtocolException {
        for (ErrorKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new ProtocolException(MALFORMED_MESSAGE, "Unknown error code " + code);
    }
}
