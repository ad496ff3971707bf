package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.service.ServerSession;
import io.github.narrowlink.transfer.core.service.SessionOutput;
import io.github.narrowlink.transfer.core.storage.FileStore;
import io.github.narrowlink.transfer.core.util.TransferSettings;
import io.netty.channel.ChannelHandlerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One per accepted connection.
 */
public class ServerConnectionHandler extends SessionHandler<ServerSession> {
    private static final Logger log = LoggerFactory.getLogger(ServerConnectionHandler.class);

    private final TransferSettings settings;
    private final FileStore store;

    public ServerConnectionHandler(TransferSettings settings, FileStore store) {
        this.settings = settings;
        this.store = store;
    }

    @Override
    protected ServerSession createSession(String peer, SessionOutput output) {
        return new ServerSession(peer, settings, store, output);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        log.info("Client connected: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        super.channelInactive(ctx);
        if (session() != null) {
            log.info("Client disconnected: {} ({})", ctx.channel().remoteAddress(), session().getState());
        }
    }
}
