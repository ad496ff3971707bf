package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;

import java.util.function.Consumer;

/**
 * Where a state machine sends its messages. Implementations deliver messages in call order and
 * run the stream callbacks on the same thread that drives the state machine.
 */
public interface SessionOutput {

    void send(ProtocolMessage message);

    /**
     * Writes every remaining chunk of {@code source}, pulling the next one only when the transport
     * can take it.
     */
    void stream(ChunkSource source, Runnable onComplete, Consumer<ProtocolException> onFailure);

    /**
     * Closes the connection once everything sent so far has been flushed.
     */
    void close();
}
