package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * One chunk on the wire. {@code data} is deflated when {@code compressed} is set and
 * {@code rawLength} is always the length of the original chunk bytes.
 */
public record FileChunkMessage(long index, boolean compressed, int rawLength, byte[] data)
        implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.FILE_CHUNK;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeUnsignedInt(out, index);
        out.writeBoolean(compressed);
        out.writeInt(rawLength);
        out.write(data);
    }

    public static FileChunkMessage read(DataInputStream in) throws IOException {
        long index = ProtocolIO.readUnsignedInt(in);
        boolean compressed = in.readBoolean();
        int rawLength = in.readInt();
        if (rawLength < 0) {
            throw new IOException("Negative raw length " + rawLength);
        }
        byte[] data = in.readAllBytes();
        return new FileChunkMessage(index, compressed, rawLength, data);
    }
}
