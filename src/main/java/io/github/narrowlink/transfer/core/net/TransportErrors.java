package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.TimeoutException;

/**
 * Maps whatever the pipeline reports onto an error kind the peer understands.
 */
final class TransportErrors {

    private TransportErrors() {
    }

    static ProtocolException classify(Throwable cause) {
        ProtocolException protocolException = ProtocolException.find(cause);
        if (protocolException != null) {
            return protocolException;
        }
        for (Throwable current = cause; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException) {
                return new ProtocolException(ErrorKind.TIMEOUT, "Connection timed out", cause);
            }
            if (current instanceof TooLongFrameException || current instanceof CorruptedFrameException) {
                return new ProtocolException(ErrorKind.MALFORMED_MESSAGE, current.getMessage(), cause);
            }
        }
        return new ProtocolException(ErrorKind.WRITE_ERROR, String.valueOf(cause.getMessage()), cause);
    }

    static ProtocolException timeout(String detail) {
        return new ProtocolException(ErrorKind.TIMEOUT, detail);
    }
}
