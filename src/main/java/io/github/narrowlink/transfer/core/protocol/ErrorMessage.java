package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Objects;

public record ErrorMessage(ErrorKind kind, String detail) implements ProtocolMessage {
    private static final int MAX_DETAIL_CHARS = 1024;

    public ErrorMessage {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
        if (detail.length() > MAX_DETAIL_CHARS) {
            detail = detail.substring(0, MAX_DETAIL_CHARS);
        }
    }

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.ERROR;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeByte(kind.code());
        ProtocolIO.writeString(out, detail);
    }

    public static ErrorMessage read(DataInputStream in) throws IOException {
        ErrorKind kind = ErrorKind.fromCode(in.readUnsignedByte());
        return new ErrorMessage(kind, ProtocolIO.readString(in));
    }

    public ProtocolException toException() {
        return new ProtocolException(kind, "Peer reported " + kind + (detail.isEmpty() ? "" : ": " + detail));
    }
}
