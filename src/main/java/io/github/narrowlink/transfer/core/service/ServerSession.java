package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.model.TransferSession;
import io.github.narrowlink.transfer.core.model.TransferState;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ErrorMessage;
import io.github.narrowlink.transfer.core.protocol.FileChunkMessage;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.FileRequestMessage;
import io.github.narrowlink.transfer.core.protocol.HandshakeAckMessage;
import io.github.narrowlink.transfer.core.protocol.HandshakeMessage;
import io.github.narrowlink.transfer.core.protocol.ListResponseMessage;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import io.github.narrowlink.transfer.core.protocol.ProtocolVersion;
import io.github.narrowlink.transfer.core.protocol.UploadCompleteMessage;
import io.github.narrowlink.transfer.core.storage.FileStore;
import io.github.narrowlink.transfer.core.storage.StagedFile;
import io.github.narrowlink.transfer.core.util.PathUtil;
import io.github.narrowlink.transfer.core.util.TransferSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;

/**
 * Server role: answers the handshake, streams requested files, receives uploads and lists the store.
 */
public class ServerSession extends TransferStateMachine {
    private static final Logger log = LoggerFactory.getLogger(ServerSession.class);

    private final TransferSettings settings;
    private final FileStore store;
    private final ChecksumService checksumService = new ChecksumService();
    private final CompressionService compressionService = new CompressionService();
    private ChunkSize chunkSize;
    private boolean compression;
    private ChunkSource download;
    private ChunkAssembler upload;

    public ServerSession(String peer, TransferSettings settings, FileStore store, SessionOutput output) {
        super(peer, output);
        this.settings = settings;
        this.store = store;
    }

    public ChunkSize getChunkSize() {
        return chunkSize;
    }

    public boolean isCompressionEnabled() {
        return compression;
    }

    @Override
    public void onMessage(ProtocolMessage message) {
        if (getState() == TransferState.FAILED) {
            log.debug("[{}] Dropping {} after failure", peer, message.type());
            return;
        }
        if (message instanceof ErrorMessage error) {
            onPeerError(error);
            return;
        }
        try {
            switch (getState()) {
                case IDLE -> onHandshake(expect(message, HandshakeMessage.class));
                case READY, COMPLETE -> onRequest(message);
                case UPLOADING -> onUploadMessage(message);
                case DOWNLOADING -> {
                    ChunkSource source = download;
                    if (source == null || !source.isExhausted()) {
                        throw violation(message);
                    }
                    // last chunk already handed to the transport; its completion callback is still queued
                    finishDownload(source);
                    onRequest(message);
                }
                default -> throw violation(message);
            }
        } catch (ProtocolException e) {
            fail(e);
        }
    }

    private void onHandshake(HandshakeMessage handshake) {
        if (!ProtocolVersion.isSupported(handshake.version())) {
            rejectHandshake("Protocol version " + handshake.version() + " is not supported");
            return;
        }
        moveTo(TransferState.HANDSHAKING);
        chunkSize = negotiateChunkSize(handshake.chunkSize());
        compression = handshake.compression() && settings.compressionAvailable();
        output.send(new HandshakeAckMessage(ProtocolVersion.CURRENT, chunkSize.bytes(), compression));
        moveTo(TransferState.READY);
        log.info("[{}] Handshake complete: chunk size {}, compression {}", peer, chunkSize.bytes(), compression);
    }

    private ChunkSize negotiateChunkSize(long proposed) {
        try {
            return settings.requireAllowed(proposed);
        } catch (ProtocolException e) {
            log.debug("[{}] Proposed chunk size {} refused, using {}", peer, proposed, settings.defaultChunkSize());
            return settings.defaultChunkSize();
        }
    }

    private void onRequest(ProtocolMessage message) throws ProtocolException {
        switch (message.type()) {
            case FILE_REQUEST -> startDownload((FileRequestMessage) message);
            case UPLOAD_START -> moveTo(TransferState.UPLOADING);
            case LIST_REQUEST -> sendListing();
            default -> throw violation(message);
        }
    }

    private void startDownload(FileRequestMessage request) throws ProtocolException {
        String name = request.name();
        FileChannel channel;
        try {
            channel = store.openForRead(name);
        } catch (ProtocolException e) {
            if (e.kind() != ErrorKind.FILE_NOT_FOUND && e.kind() != ErrorKind.INVALID_FILENAME) {
                throw e;
            }
            log.info("[{}] Refusing download of '{}': {}", peer, name, e.kind());
            output.send(new ErrorMessage(e.kind(), e.getMessage()));
            moveTo(TransferState.READY);
            return;
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to open " + name, e);
        }

        ChunkSource source;
        try {
            long size = channel.size();
            byte[] digest = checksumService.digest(channel, size);
            FileMetadata metadata = new FileMetadata(name, size, chunkSize.bytes(), compression, digest);
            source = new ChunkSource(channel, new TransferSession(metadata, chunkSize), compressionService,
                    settings.compressionLevel());
        } catch (IOException e) {
            closeQuietly(channel);
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to read " + name, e);
        }

        download = source;
        moveTo(TransferState.DOWNLOADING);
        FileMetadata metadata = source.getSession().getMetadata();
        log.info("[{}] Sending {} ({} bytes in {} chunks)", peer, name, metadata.getSize(), metadata.chunkCount());
        output.send(metadata);
        if (!source.hasNext()) {
            finishDownload(source);
            return;
        }
        output.stream(source, () -> finishDownload(source), error -> onStreamFailure(source, error));
    }

    private void finishDownload(ChunkSource source) {
        if (download != source) {
            return;
        }
        download = null;
        source.close();
        moveTo(TransferState.COMPLETE);
        TransferSession session = source.getSession();
        log.info("[{}] Sent {}: {} bytes in {} chunks ({} ms)", peer, session.getMetadata().getName(),
                session.getBytesTransferred(), session.getChunksTransferred(), session.getDuration().toMillis());
    }

    private void onStreamFailure(ChunkSource source, ProtocolException error) {
        if (download != source) {
            return;
        }
        fail(error);
    }

    private void onUploadMessage(ProtocolMessage message) throws ProtocolException {
        switch (message.type()) {
            case FILE_METADATA -> {
                if (upload != null) {
                    throw violation(message);
                }
                beginUpload((FileMetadata) message);
            }
            case FILE_CHUNK -> {
                if (upload == null) {
                    throw violation(message);
                }
                upload.accept((FileChunkMessage) message);
                if (upload.isComplete()) {
                    finishUpload();
                }
            }
            default -> throw violation(message);
        }
    }

    private void beginUpload(FileMetadata metadata) throws ProtocolException {
        PathUtil.requireValidFileName(metadata.getName());
        ChunkSize size = settings.requireAllowed(metadata.getChunkSize());
        requireIndexable(metadata);
        if (metadata.isCompressed() && !compression) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION, "Compression was not negotiated");
        }
        StagedFile staged;
        try {
            staged = store.openForWriteTemp();
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to stage " + metadata.getName(), e);
        }
        upload = new ChunkAssembler(new TransferSession(metadata, size), staged, compressionService);
        log.info("[{}] Receiving {} ({} bytes in {} chunks)", peer, metadata.getName(), metadata.getSize(),
                metadata.chunkCount());
        if (upload.isComplete()) {
            finishUpload();
        }
    }

    private void finishUpload() throws ProtocolException {
        ChunkAssembler assembler = upload;
        TransferSession session = assembler.getSession();
        FileMetadata metadata = session.getMetadata();
        moveTo(TransferState.VERIFYING);
        if (!assembler.verify()) {
            throw new ProtocolException(ErrorKind.CHECKSUM_MISMATCH, "Digest mismatch for " + metadata.getName()
                    + ": expected " + metadata.getDigestHex()
                    + " but received " + ChecksumService.toHex(session.computedDigest()));
        }
        try {
            store.commit(assembler.getStagedFile(), metadata.getName());
        } catch (ProtocolException e) {
            throw e;
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to commit " + metadata.getName(), e);
        }
        upload = null;
        output.send(new UploadCompleteMessage(metadata.getName(), metadata.getDigest()));
        moveTo(TransferState.COMPLETE);
        log.info("[{}] Received {}: {} bytes in {} chunks ({} ms)", peer, metadata.getName(),
                session.getBytesTransferred(), session.getChunksTransferred(), session.getDuration().toMillis());
    }

    private void sendListing() throws ProtocolException {
        try {
            output.send(new ListResponseMessage(store.list()));
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to list files", e);
        }
    }

    @Override
    protected void releaseSession() {
        if (upload != null) {
            upload.close();
            upload = null;
        }
        if (download != null) {
            download.close();
            download = null;
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close file channel", e);
        }
    }
}
