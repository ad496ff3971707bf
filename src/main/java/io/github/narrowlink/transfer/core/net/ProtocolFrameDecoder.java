package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolIO;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;

import java.util.List;

/**
 * Cuts the inbound byte stream at message boundaries using the u32 length in the header and
 * decodes each complete frame. Partial frames stay buffered until the rest arrives.
 */
public class ProtocolFrameDecoder extends LengthFieldBasedFrameDecoder {

    public ProtocolFrameDecoder(int maxFrameLength) {
        super(maxFrameLength, ProtocolIO.LENGTH_FIELD_OFFSET, ProtocolIO.LENGTH_FIELD_LENGTH, 0, 0);
    }

    @Override
    protected Object decode(ChannelHandlerContext ctx, ByteBuf in) throws Exception {
        ByteBuf frame = (ByteBuf) super.decode(ctx, in);
        if (frame == null) {
            return null;
        }
        try {
            byte[] data = new byte[frame.readableBytes()];
            frame.readBytes(data);
            return ProtocolIO.fromByteArray(data);
        } finally {
            frame.release();
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            int pending = in.readableBytes();
            in.skipBytes(pending);
            throw new ProtocolException(ErrorKind.TRUNCATED,
                    "Connection closed with " + pending + " bytes of an incomplete message");
        }
    }
}
