package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.ChunkSize;
import io.github.narrowlink.transfer.core.model.CompressionLevel;
import io.github.narrowlink.transfer.core.model.FileEntry;
import io.github.narrowlink.transfer.core.model.TransferSession;
import io.github.narrowlink.transfer.core.model.TransferState;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ErrorMessage;
import io.github.narrowlink.transfer.core.protocol.FileChunkMessage;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.FileRequestMessage;
import io.github.narrowlink.transfer.core.protocol.HandshakeAckMessage;
import io.github.narrowlink.transfer.core.protocol.HandshakeMessage;
import io.github.narrowlink.transfer.core.protocol.ListRequestMessage;
import io.github.narrowlink.transfer.core.protocol.ListResponseMessage;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import io.github.narrowlink.transfer.core.protocol.ProtocolVersion;
import io.github.narrowlink.transfer.core.protocol.UploadCompleteMessage;
import io.github.narrowlink.transfer.core.protocol.UploadStartMessage;
import io.github.narrowlink.transfer.core.storage.StagedFile;
import io.github.narrowlink.transfer.core.util.PathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Client role. Operations are issued one at a time from the caller's thread and completed from
 * the connection's thread, so every entry point is synchronized.
 */
public class ClientSession extends TransferStateMachine {
    private static final Logger log = LoggerFactory.getLogger(ClientSession.class);

    private final CompressionLevel compressionLevel;
    private final ChecksumService checksumService = new ChecksumService();
    private final CompressionService compressionService = new CompressionService();
    private ChunkSize chunkSize;
    private boolean compression;

    private CompletableFuture<HandshakeAckMessage> handshakeFuture;
    private CompletableFuture<List<FileEntry>> listFuture;

    private String downloadName;
    private Path downloadTarget;
    private ChunkAssembler download;
    private CompletableFuture<FileMetadata> downloadFuture;

    private ChunkSource upload;
    private CompletableFuture<FileMetadata> uploadFuture;
    private boolean disconnected;

    public ClientSession(String peer, CompressionLevel compressionLevel, SessionOutput output) {
        super(peer, output);
        this.compressionLevel = compressionLevel;
    }

    public synchronized ChunkSize getChunkSize() {
        return chunkSize;
    }

    public synchronized boolean isCompressionEnabled() {
        return compression;
    }

    public synchronized CompletableFuture<HandshakeAckMessage> handshake(ChunkSize preferred, boolean wantCompression) {
        if (getState() != TransferState.IDLE) {
            return CompletableFuture.failedFuture(new IllegalStateException("Handshake already sent"));
        }
        handshakeFuture = new CompletableFuture<>();
        moveTo(TransferState.HANDSHAKING);
        output.send(new HandshakeMessage(ProtocolVersion.CURRENT, preferred.bytes(), wantCompression));
        return handshakeFuture;
    }

    /**
     * Requests {@code name} and writes it to {@code target} once its digest has been verified.
     */
    public synchronized CompletableFuture<FileMetadata> download(String name, Path target) {
        Exception busy = requireIdle();
        if (busy != null) {
            return CompletableFuture.failedFuture(busy);
        }
        try {
            PathUtil.requireValidFileName(name);
        } catch (ProtocolException e) {
            return CompletableFuture.failedFuture(e);
        }
        downloadName = name;
        downloadTarget = target.toAbsolutePath();
        downloadFuture = new CompletableFuture<>();
        moveTo(TransferState.DOWNLOADING);
        output.send(new FileRequestMessage(name));
        return downloadFuture;
    }

    /**
     * Sends {@code file} to be stored as {@code remoteName}; completes when the server confirms the commit.
     */
    public synchronized CompletableFuture<FileMetadata> upload(Path file, String remoteName) {
        Exception busy = requireIdle();
        if (busy != null) {
            return CompletableFuture.failedFuture(busy);
        }
        ChunkSource source;
        try {
            PathUtil.requireValidFileName(remoteName);
            source = openSource(file, remoteName);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        upload = source;
        uploadFuture = new CompletableFuture<>();
        CompletableFuture<FileMetadata> result = uploadFuture;
        moveTo(TransferState.UPLOADING);
        FileMetadata metadata = source.getSession().getMetadata();
        log.info("Uploading {} as {} ({} bytes in {} chunks)", file, remoteName, metadata.getSize(),
                metadata.chunkCount());
        output.send(new UploadStartMessage());
        output.send(metadata);
        if (source.hasNext()) {
            output.stream(source, () -> uploadSent(source), error -> onStreamFailure(source, error));
        } else {
            uploadSent(source);
        }
        return result;
    }

    public synchronized CompletableFuture<List<FileEntry>> list() {
        Exception busy = requireIdle();
        if (busy != null) {
            return CompletableFuture.failedFuture(busy);
        }
        listFuture = new CompletableFuture<>();
        output.send(new ListRequestMessage());
        return listFuture;
    }

    private Exception requireIdle() {
        if (disconnected) {
            return new ProtocolException(ErrorKind.TRUNCATED, "Connection to " + peer + " is closed");
        }
        if (!getState().acceptsRequests() || listFuture != null) {
            return new IllegalStateException("Session busy in state " + getState());
        }
        return null;
    }

    private ChunkSource openSource(Path file, String remoteName) throws IOException {
        FileChannel channel = FileChannel.open(file, StandardOpenOption.READ);
        try {
            long size = channel.size();
            byte[] digest = checksumService.digest(channel, size);
            FileMetadata metadata = new FileMetadata(remoteName, size, chunkSize.bytes(), compression, digest);
            return new ChunkSource(channel, new TransferSession(metadata, chunkSize), compressionService,
                    compressionLevel);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    @Override
    public synchronized void onMessage(ProtocolMessage message) {
        if (getState() == TransferState.FAILED) {
            log.debug("[{}] Dropping {} after failure", peer, message.type());
            return;
        }
        if (message instanceof ErrorMessage error) {
            onError(error);
            return;
        }
        try {
            switch (getState()) {
                case HANDSHAKING -> onHandshakeAck(expect(message, HandshakeAckMessage.class));
                case READY, COMPLETE -> onListResponse(expect(message, ListResponseMessage.class));
                case DOWNLOADING -> onDownloadMessage(message);
                case UPLOADING, VERIFYING -> onUploadComplete(expect(message, UploadCompleteMessage.class));
                default -> throw violation(message);
            }
        } catch (ProtocolException e) {
            fail(e);
        }
    }

    private void onError(ErrorMessage error) {
        boolean refusedRequest = getState() == TransferState.DOWNLOADING && download == null
                && (error.kind() == ErrorKind.FILE_NOT_FOUND || error.kind() == ErrorKind.INVALID_FILENAME);
        if (!refusedRequest) {
            onPeerError(error);
            return;
        }
        log.info("[{}] Download of {} refused: {}", peer, downloadName, error.kind());
        CompletableFuture<FileMetadata> future = downloadFuture;
        clearDownload();
        moveTo(TransferState.READY);
        future.completeExceptionally(error.toException());
    }

    private void onHandshakeAck(HandshakeAckMessage ack) throws ProtocolException {
        if (ack.version() != ProtocolVersion.CURRENT) {
            throw new ProtocolException(ErrorKind.VERSION_UNSUPPORTED,
                    "Server answered with protocol version " + ack.version());
        }
        chunkSize = ChunkSize.of(ack.chunkSize());
        compression = ack.compression();
        moveTo(TransferState.READY);
        log.info("[{}] Connected: chunk size {}, compression {}", peer, chunkSize.bytes(), compression);
        CompletableFuture<HandshakeAckMessage> future = handshakeFuture;
        handshakeFuture = null;
        future.complete(ack);
    }

    private void onListResponse(ListResponseMessage response) throws ProtocolException {
        if (listFuture == null) {
            throw violation(response);
        }
        CompletableFuture<List<FileEntry>> future = listFuture;
        listFuture = null;
        future.complete(response.entries());
    }

    private void onDownloadMessage(ProtocolMessage message) throws ProtocolException {
        if (download == null) {
            beginDownload(expect(message, FileMetadata.class));
            return;
        }
        download.accept(expect(message, FileChunkMessage.class));
        if (download.isComplete()) {
            finishDownload();
        }
    }

    private void beginDownload(FileMetadata metadata) throws ProtocolException {
        if (!metadata.getName().equals(downloadName)) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                    "Requested " + downloadName + " but server sent " + metadata.getName());
        }
        if (metadata.getChunkSize() != chunkSize.bytes()) {
            throw new ProtocolException(ErrorKind.INVALID_CHUNK_SIZE,
                    "Server used chunk size " + metadata.getChunkSize() + " instead of " + chunkSize.bytes());
        }
        if (metadata.isCompressed() && !compression) {
            throw new ProtocolException(ErrorKind.PROTOCOL_VIOLATION, "Compression was not negotiated");
        }
        requireIndexable(metadata);
        StagedFile staged;
        try {
            staged = StagedFile.create(downloadTarget.getParent());
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to stage " + downloadTarget, e);
        }
        download = new ChunkAssembler(new TransferSession(metadata, chunkSize), staged, compressionService);
        log.info("[{}] Receiving {} ({} bytes in {} chunks)", peer, metadata.getName(), metadata.getSize(),
                metadata.chunkCount());
        if (download.isComplete()) {
            finishDownload();
        }
    }

    private void finishDownload() throws ProtocolException {
        ChunkAssembler assembler = download;
        TransferSession session = assembler.getSession();
        FileMetadata metadata = session.getMetadata();
        moveTo(TransferState.VERIFYING);
        if (!assembler.verify()) {
            throw new ProtocolException(ErrorKind.CHECKSUM_MISMATCH, "Digest mismatch for " + metadata.getName()
                    + ": expected " + metadata.getDigestHex()
                    + " but received " + ChecksumService.toHex(session.computedDigest()));
        }
        try {
            assembler.getStagedFile().commitTo(downloadTarget);
        } catch (IOException e) {
            throw new ProtocolException(ErrorKind.WRITE_ERROR, "Failed to write " + downloadTarget, e);
        }
        log.info("[{}] Downloaded {} to {}: {} bytes ({} ms)", peer, metadata.getName(), downloadTarget,
                session.getBytesTransferred(), session.getDuration().toMillis());
        CompletableFuture<FileMetadata> future = downloadFuture;
        clearDownload();
        moveTo(TransferState.COMPLETE);
        future.complete(metadata);
    }

    private synchronized void uploadSent(ChunkSource source) {
        if (upload != source || getState() != TransferState.UPLOADING) {
            return;
        }
        source.close();
        moveTo(TransferState.VERIFYING);
    }

    private synchronized void onStreamFailure(ChunkSource source, ProtocolException error) {
        if (upload != source) {
            return;
        }
        fail(error);
    }

    private void onUploadComplete(UploadCompleteMessage complete) throws ProtocolException {
        ChunkSource source = upload;
        if (source == null || !source.isExhausted()) {
            throw violation(complete);
        }
        FileMetadata metadata = source.getSession().getMetadata();
        if (!metadata.getName().equals(complete.getName())
                || !Arrays.equals(metadata.getDigest(), complete.getDigest())) {
            throw new ProtocolException(ErrorKind.CHECKSUM_MISMATCH,
                    "Server confirmed " + complete.getName() + " with a different digest");
        }
        if (getState() == TransferState.UPLOADING) {
            moveTo(TransferState.VERIFYING);
        }
        source.close();
        upload = null;
        CompletableFuture<FileMetadata> future = uploadFuture;
        uploadFuture = null;
        moveTo(TransferState.COMPLETE);
        log.info("[{}] Uploaded {}: {} bytes ({} ms)", peer, metadata.getName(), metadata.getSize(),
                source.getSession().getDuration().toMillis());
        future.complete(metadata);
    }

    private void clearDownload() {
        downloadName = null;
        downloadTarget = null;
        download = null;
        downloadFuture = null;
    }

    @Override
    public synchronized void onTransportFailure(ProtocolException error) {
        super.onTransportFailure(error);
    }

    @Override
    public synchronized void onDisconnect() {
        disconnected = true;
        super.onDisconnect();
    }

    @Override
    protected void releaseSession() {
        if (download != null) {
            download.close();
        }
        if (upload != null) {
            upload.close();
            upload = null;
        }
    }

    @Override
    protected void onFailed(ProtocolException error) {
        failPending(handshakeFuture, error);
        failPending(listFuture, error);
        failPending(downloadFuture, error);
        failPending(uploadFuture, error);
        handshakeFuture = null;
        listFuture = null;
        uploadFuture = null;
        clearDownload();
    }

    private static void failPending(CompletableFuture<?> future, ProtocolException error) {
        if (future != null) {
            future.completeExceptionally(error);
        }
    }
}
