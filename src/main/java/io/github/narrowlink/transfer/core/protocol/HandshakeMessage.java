package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Client proposal: protocol version, preferred chunk size and whether it wants compression.
 */
public record HandshakeMessage(int version, long chunkSize, boolean compression) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.HANDSHAKE;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeByte(version);
        ProtocolIO.writeUnsignedInt(out, chunkSize);
        out.writeBoolean(compression);
    }

    public static HandshakeMessage read(DataInputStream in) throws IOException {
        int version = in.readUnsignedByte();
        long chunkSize = ProtocolIO.readUnsignedInt(in);
        boolean compression = in.readBoolean();
        return new HandshakeMessage(version, chunkSize, compression);
    }
}
