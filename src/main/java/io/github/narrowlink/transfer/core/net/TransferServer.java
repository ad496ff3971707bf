package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.storage.FileStore;
import io.github.narrowlink.transfer.core.util.TransferSettings;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;

/**
 * Accepts connections and gives each its own {@link ServerConnectionHandler}. Session work runs on
 * a separate executor group so file I/O never blocks the accept loop or other connections.
 */
public class TransferServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransferServer.class);

    private final TransferSettings settings;
    private final FileStore store;
    private final MultiThreadIoEventLoopGroup bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    private final MultiThreadIoEventLoopGroup workerGroup = new MultiThreadIoEventLoopGroup(NioIoHandler.newFactory());
    private final EventExecutorGroup sessionGroup =
            new DefaultEventExecutorGroup(Math.max(4, Runtime.getRuntime().availableProcessors() * 2));
    private Channel serverChannel;

    public TransferServer(TransferSettings settings, FileStore store) {
        this.settings = settings;
        this.store = store;
    }

    public void start() throws IOException {
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        TransferPipeline.configure(ch.pipeline(), settings, sessionGroup,
                                new ServerConnectionHandler(settings, store));
                    }
                });
        try {
            serverChannel = b.bind(settings.host(), settings.port()).sync().channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while binding port " + settings.port(), e);
        } catch (Exception e) {
            close();
            throw new IOException("Failed to bind " + settings.host() + ":" + settings.port(), e);
        }
        log.info("Server listening on {}", serverChannel.localAddress());
    }

    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /**
     * Blocks until the listening channel is closed.
     */
    public void awaitClose() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void close() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();
        sessionGroup.shutdownGracefully();
        log.info("Server stopped");
    }
}
