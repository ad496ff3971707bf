package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Server answer carrying the values that hold for the rest of the connection.
 */
public record HandshakeAckMessage(int version, long chunkSize, boolean compression) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.HANDSHAKE_ACK;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        out.writeByte(version);
        ProtocolIO.writeUnsignedInt(out, chunkSize);
        out.writeBoolean(compression);
    }

    public static HandshakeAckMessage read(DataInputStream in) throws IOException {
        int version = in.readUnsignedByte();
        long chunkSize = ProtocolIO.readUnsignedInt(in);
        boolean compression = in.readBoolean();
        return new HandshakeAckMessage(version, chunkSize, compression);
    }
}
