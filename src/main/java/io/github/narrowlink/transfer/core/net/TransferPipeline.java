package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.util.TransferSettings;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.stream.ChunkedWriteHandler;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.util.concurrent.EventExecutorGroup;

import java.util.concurrent.TimeUnit;

/**
 * Handler layout shared by both ends of a connection.
 */
final class TransferPipeline {

    private TransferPipeline() {
    }

    static void configure(ChannelPipeline pipeline, TransferSettings settings, EventExecutorGroup sessionGroup,
                          SessionHandler<?> handler) {
        // a connection is idle only when nothing is read and no queued write makes progress
        pipeline.addLast("idle", new IdleStateHandler(true, 0, 0,
                settings.readTimeout().toMillis(), TimeUnit.MILLISECONDS));
        pipeline.addLast("writeTimeout", new WriteTimeoutHandler(
                settings.writeTimeout().toMillis(), TimeUnit.MILLISECONDS));
        pipeline.addLast("decoder", new ProtocolFrameDecoder(TransferSettings.MAX_FRAME_LENGTH));
        pipeline.addLast("encoder", new ProtocolFrameEncoder());
        // chunk reads, digests and deflate run on the session executor, not the I/O loop
        pipeline.addLast(sessionGroup, "chunkedWriter", new ChunkedWriteHandler());
        pipeline.addLast(sessionGroup, "session", handler);
    }
}
