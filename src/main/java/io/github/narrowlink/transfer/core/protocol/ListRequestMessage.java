package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;

public record ListRequestMessage() implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.LIST_REQUEST;
    }

    @Override
    public void write(DataOutputStream out) {
        // empty payload
    }

    public static ListRequestMessage read(DataInputStream in) {
        return new ListRequestMessage();
    }
}
