package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import io.github.narrowlink.transfer.core.service.ChunkSource;
import io.github.narrowlink.transfer.core.service.SessionOutput;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Writes through the handler's context, so messages pass the chunked writer and the encoder
 * in the order they were sent. Stream callbacks are run on the handler's executor.
 */
class ChannelSessionOutput implements SessionOutput {
    private static final Logger log = LoggerFactory.getLogger(ChannelSessionOutput.class);

    private final ChannelHandlerContext ctx;

    ChannelSessionOutput(ChannelHandlerContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public void send(ProtocolMessage message) {
        if (!ctx.channel().isActive()) {
            log.debug("Channel {} closed, dropping {}", ctx.channel(), message.type());
            return;
        }
        ctx.writeAndFlush(message).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    @Override
    public void stream(ChunkSource source, Runnable onComplete, Consumer<ProtocolException> onFailure) {
        ctx.writeAndFlush(new ChunkedMessageInput(source)).addListener(future -> ctx.executor().execute(() -> {
            if (future.isSuccess()) {
                onComplete.run();
            } else {
                onFailure.accept(TransportErrors.classify(future.cause()));
            }
        }));
    }

    @Override
    public void close() {
        ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE);
    }
}
