package io.github.narrowlink.transfer.core.protocol;

import java.io.IOException;
import java.util.Objects;

public class ProtocolException extends IOException {
    private final ErrorKind kind;

    public ProtocolException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ProtocolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Finds the first {@link ProtocolException} in a cause chain, as Netty wraps decoder failures.
     */
    public static ProtocolException find(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProtocolException protocolException) {
                return protocolException;
            }
            current = current.getCause();
        }
        return null;
    }
}
