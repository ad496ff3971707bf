package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.service.ClientSession;
import io.github.narrowlink.transfer.core.service.SessionOutput;
import io.netty.channel.ChannelHandlerContext;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes its {@link ClientSession} once the channel is active.
 */
class ClientConnectionHandler extends SessionHandler<ClientSession> {
    private final CompressionLevel compressionLevel;
    private final CompletableFuture<ClientSession> ready = new CompletableFuture<>();

    ClientConnectionHandler(CompressionLevel compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    CompletableFuture<ClientSession> ready() {
        return ready;
    }

    @Override
    protected ClientSession createSession(String peer, SessionOutput output) {
        return new ClientSession(peer, compressionLevel, output);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        super.channelActive(ctx);
        ready.complete(session());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        super.channelInactive(ctx);
        ready.completeExceptionally(new ProtocolException(ErrorKind.TRUNCATED, "Connection closed before it was ready"));
    }
}
