package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import io.github.narrowlink.transfer.core.protocol.ProtocolMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects everything a state machine sends; streams are drained synchronously.
 */
class RecordingOutput implements SessionOutput {
    final List<ProtocolMessage> sent = new ArrayList<>();
    boolean closed;

    @Override
    public void send(ProtocolMessage message) {
        sent.add(message);
    }

    @Override
    public void stream(ChunkSource source, Runnable onComplete, Consumer<ProtocolException> onFailure) {
        try {
            while (source.hasNext()) {
                sent.add(source.next());
            }
        } catch (IOException e) {
            onFailure.accept(new ProtocolException(ErrorKind.WRITE_ERROR, e.getMessage(), e));
            return;
        }
        onComplete.run();
    }

    @Override
    public void close() {
        closed = true;
    }

    ProtocolMessage last() {
        return sent.get(sent.size() - 1);
    }

    <T extends ProtocolMessage> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (ProtocolMessage message : sent) {
            if (type.isInstance(message)) {
                result.add(type.cast(message));
            }
        }
        return result;
    }
}
