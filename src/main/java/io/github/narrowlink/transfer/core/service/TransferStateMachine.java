package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.model.TransferState;
import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ErrorMessage;
import io.github.narrowlink.transfer.core.protocol.FileMetadata;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Connection-level protocol state shared by both roles. One instance per connection, driven by a
 * single thread at a time; it never resynchronises after an error, it fails and closes.
 */
public abstract class TransferStateMachine {
    private static final Logger log = LoggerFactory.getLogger(TransferStateMachine.class);

    protected final String peer;
    protected final SessionOutput output;
    private volatile TransferState state = TransferState.IDLE;

    protected TransferStateMachine(String peer, SessionOutput output) {
        this.peer = Objects.requireNonNull(peer, "peer");
        this.output = Objects.requireNonNull(output, "output");
    }

    public TransferState getState() {
        return state;
    }

    public abstract void onMessage(ProtocolMessage message);

    /**
     * Releases the current transfer: staged files are discarded, open sources closed.
     */
    protected abstract void releaseSession();

    /**
     * Called once after the machine reached FAILED or the connection went away.
     */
    protected void onFailed(ProtocolException error) {
    }

    protected void moveTo(TransferState next) {
        TransferState current = state;
        if (!current.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + current + " -> " + next);
        }
        log.debug("[{}] {} -> {}", peer, current, next);
        state = next;
    }

    protected <T extends ProtocolMessage> T expect(ProtocolMessage message, Class<T> type) throws ProtocolException {
        if (!type.isInstance(message)) {
            throw violation(message);
        }
        return type.cast(message);
    }

    protected ProtocolException violation(ProtocolMessage message) {
        return new ProtocolException(ErrorKind.PROTOCOL_VIOLATION,
                "Unexpected " + message.type() + " in state " + state);
    }

    /**
     * Rejects metadata whose chunks could not all be indexed on the wire.
     */
    protected static void requireIndexable(FileMetadata metadata) throws ProtocolException {
        if (metadata.chunkCount() > Chunker.MAX_CHUNK_COUNT) {
            throw new ProtocolException(ErrorKind.MALFORMED_MESSAGE, "Size " + metadata.getSize()
                    + " of " + metadata.getName() + " needs more than " + Chunker.MAX_CHUNK_COUNT + " chunks");
        }
    }

    /**
     * Refuses a handshake without leaving IDLE.
     */
    protected void rejectHandshake(String reason) {
        log.warn("[{}] Rejecting handshake: {}", peer, reason);
        output.send(new ErrorMessage(ErrorKind.VERSION_UNSUPPORTED, reason));
        output.close();
    }

    /**
     * Fatal error on this side: tell the peer if it is still reachable, then close.
     */
    protected void fail(ProtocolException error) {
        if (state == TransferState.FAILED) {
            return;
        }
        log.warn("[{}] Failing in state {} with {}: {}", peer, state, error.kind(), error.getMessage());
        releaseSession();
        moveTo(TransferState.FAILED);
        output.send(new ErrorMessage(error.kind(), error.getMessage()));
        output.close();
        onFailed(error);
    }

    /**
     * The peer reported a terminal error.
     */
    protected void onPeerError(ErrorMessage error) {
        if (state == TransferState.FAILED) {
            return;
        }
        log.warn("[{}] Peer reported {} in state {}: {}", peer, error.kind(), state, error.detail());
        releaseSession();
        moveTo(TransferState.FAILED);
        output.close();
        onFailed(error.toException());
    }

    /**
     * Codec errors, timeouts and I/O failures reported by the transport.
     */
    public void onTransportFailure(ProtocolException error) {
        if (error.kind() == ErrorKind.VERSION_UNSUPPORTED && state == TransferState.IDLE) {
            rejectHandshake(error.getMessage());
            return;
        }
        fail(error);
    }

    public void onDisconnect() {
        if (state == TransferState.FAILED) {
            return;
        }
        releaseSession();
        if (state != TransferState.IDLE && !state.acceptsRequests()) {
            log.warn("[{}] Connection closed in state {}", peer, state);
            moveTo(TransferState.FAILED);
        }
        onFailed(new ProtocolException(ErrorKind.TRUNCATED, "Connection closed by " + peer));
    }
}
