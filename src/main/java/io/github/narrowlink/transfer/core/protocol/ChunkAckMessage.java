package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

public record ChunkAckMessage(long index) implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.CHUNK_ACK;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeUnsignedInt(out, index);
    }

    public static ChunkAckMessage read(DataInputStream in) throws IOException {
        return new ChunkAckMessage(ProtocolIO.readUnsignedInt(in));
    }
}
