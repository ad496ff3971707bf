package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.ProtocolIO;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

public class ProtocolFrameEncoder extends MessageToByteEncoder<ProtocolMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, ProtocolMessage msg, ByteBuf out) throws Exception {
        out.writeBytes(ProtocolIO.toByteArray(msg));
    }
}
