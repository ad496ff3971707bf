package io.github.narrowlink.transfer.core.protocol;

import java.io.DataOutputStream;
import java.io.IOException;

public interface ProtocolMessage {
    ProtocolMessageType type();

    /**
     * Writes the payload only; the header is added by {@link ProtocolIO}.
     */
    void write(DataOutputStream out) throws IOException;
}
