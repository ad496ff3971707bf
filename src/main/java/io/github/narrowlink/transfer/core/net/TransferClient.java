package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.model.FileEntry;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.HandshakeAckMessage;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.service.ClientSession;
import io.github.narrowlink.transfer.core.util.TransferSettings;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client over one connection. Each call waits for its operation to finish; a stalled peer
 * is cut off by the pipeline's idle timeout, which fails the pending call with {@code TIMEOUT}.
 */
public class TransferClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransferClient.class);

    private final MultiThreadIoEventLoopGroup group;
    private final EventExecutorGroup sessionGroup;
    private final Channel channel;
    private final ClientSession session;

    private TransferClient(MultiThreadIoEventLoopGroup group, EventExecutorGroup sessionGroup, Channel channel,
                           ClientSession session) {
        this.group = group;
        this.sessionGroup = sessionGroup;
        this.channel = channel;
        this.session = session;
    }

    /**
     * Opens a connection and completes the handshake.
     */
    public static TransferClient connect(String host, int port, TransferSettings settings, ChunkSize chunkSize,
                                         boolean compression) throws IOException {
        MultiThreadIoEventLoopGroup group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        EventExecutorGroup sessionGroup = new DefaultEventExecutorGroup(1);
        ClientConnectionHandler handler = new ClientConnectionHandler(settings.compressionLevel());
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) settings.readTimeout().toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        TransferPipeline.configure(ch.pipeline(), settings, sessionGroup, handler);
                    }
                });
        TransferClient client = null;
        try {
            Channel channel = b.connect(host, port).sync().channel();
            ClientSession session = await(handler.ready(), settings.readTimeout().toMillis());
            client = new TransferClient(group, sessionGroup, channel, session);
            HandshakeAckMessage ack = await(session.handshake(chunkSize, compression),
                    settings.readTimeout().toMillis());
            log.info("Connected to {}:{} (chunk size {}, compression {})", host, port, ack.chunkSize(),
                    ack.compression());
            return client;
        } catch (IOException e) {
            shutdown(client, group, sessionGroup);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown(client, group, sessionGroup);
            throw new IOException("Interrupted while connecting to " + host + ":" + port, e);
        } catch (Exception e) {
            shutdown(client, group, sessionGroup);
            throw new IOException("Failed to connect to " + host + ":" + port, e);
        }
    }

    public ChunkSize getChunkSize() {
        return session.getChunkSize();
    }

    public boolean isCompressionEnabled() {
        return session.isCompressionEnabled();
    }

    public FileMetadata download(String name, Path target) throws IOException {
        return await(session.download(name, target), 0);
    }

    public FileMetadata upload(Path file, String remoteName) throws IOException {
        return await(session.upload(file, remoteName), 0);
    }

    public List<FileEntry> list() throws IOException {
        return await(session.list(), 0);
    }

    private static <T> T await(CompletableFuture<T> future, long timeoutMillis) throws IOException {
        try {
            return timeoutMillis > 0 ? future.get(timeoutMillis, TimeUnit.MILLISECONDS) : future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause);
        } catch (TimeoutException e) {
            throw new ProtocolException(ErrorKind.TIMEOUT, "No answer within " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for the server", e);
        }
    }

    private static void shutdown(TransferClient client, MultiThreadIoEventLoopGroup group,
                                 EventExecutorGroup sessionGroup) {
        if (client != null) {
            client.close();
            return;
        }
        group.shutdownGracefully();
        sessionGroup.shutdownGracefully();
    }

    @Override
    public void close() {
        channel.close().syncUninterruptibly();
        group.shutdownGracefully();
        sessionGroup.shutdownGracefully();
    }
}
