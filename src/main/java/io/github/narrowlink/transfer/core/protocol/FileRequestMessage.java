package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Objects;

public record FileRequestMessage(String name) implements ProtocolMessage {
    public FileRequestMessage {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_REQUEST;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, name);
    }

    public static FileRequestMessage read(DataInputStream in) throws IOException {
        return new FileRequestMessage(ProtocolIO.readString(in));
    }
}
