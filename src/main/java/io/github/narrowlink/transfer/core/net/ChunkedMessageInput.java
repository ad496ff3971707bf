package io.github.narrowlink.transfer.core.net;

import io.github.narrowlink.transfer.core.protocol.FileChunkMessage;
import io.github.narrowlink.transfer.core.service.ChunkSource;
import io.netty.buffer.ByteBufAllocator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.stream.ChunkedInput;

/**
 * Lets {@link io.netty.handler.stream.ChunkedWriteHandler} pull FILE_CHUNK messages one at a time,
 * only while the channel is writable.
 */
public class ChunkedMessageInput implements ChunkedInput<FileChunkMessage> {
    private final ChunkSource source;

    public ChunkedMessageInput(ChunkSource source) {
        this.source = source;
    }

    @Override
    public boolean isEndOfInput() {
        return !source.hasNext();
    }

    @Override
    public void close() {
        source.close();
    }

    @Deprecated
    @Override
    public FileChunkMessage readChunk(ChannelHandlerContext ctx) throws Exception {
        return readChunk(ctx.alloc());
    }

    @Override
    public FileChunkMessage readChunk(ByteBufAllocator allocator) throws Exception {
        if (isEndOfInput()) {
            return null;
        }
        return source.next();
    }

    @Override
    public long length() {
        return source.getSession().getMetadata().getSize();
    }

    @Override
    public long progress() {
        return source.getSession().getBytesTransferred();
    }
}
