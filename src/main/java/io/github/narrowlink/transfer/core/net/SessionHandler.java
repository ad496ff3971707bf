package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import io.github.narrowlink.transfer.core.service.SessionOutput;
import io.github.narrowlink.transfer.core.service.TransferStateMachine;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;

/**
 * Binds one channel to one state machine. Decoded messages, codec failures, idle timeouts and
 * disconnects are all forwarded to the machine; it decides what goes back on the wire.
 */
abstract class SessionHandler<S extends TransferStateMachine> extends SimpleChannelInboundHandler<ProtocolMessage> {
    private static final Logger log = LoggerFactory.getLogger(SessionHandler.class);

    private S session;

    protected abstract S createSession(String peer, SessionOutput output);

    S session() {
        return session;
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        session = createSession(describe(ctx.channel().remoteAddress()), new ChannelSessionOutput(ctx));
        log.debug("Channel {} active", ctx.channel());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ProtocolMessage msg) {
        log.trace("[{}] <- {}", ctx.channel().remoteAddress(), msg.type());
        session.onMessage(msg);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent && session != null) {
            session.onTransportFailure(TransportErrors.timeout("No traffic for too long"));
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ProtocolException error = TransportErrors.classify(cause);
        log.debug("Channel {} failed with {}", ctx.channel(), error.kind(), cause);
        if (session == null) {
            ctx.close();
            return;
        }
        session.onTransportFailure(error);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (session != null) {
            session.onDisconnect();
        }
        log.debug("Channel {} inactive", ctx.channel());
        super.channelInactive(ctx);
    }

    private static String describe(SocketAddress address) {
        return address == null ? "unknown" : address.toString();
    }
}
