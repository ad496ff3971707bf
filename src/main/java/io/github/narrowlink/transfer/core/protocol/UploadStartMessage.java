package io.github.narrowlink.transfer.core.protocol;

import java.io.DataInputStream;
import java.io.DataOutputStream;

/**
 * Announces an upload; FILE_METADATA and the chunk stream follow.
 */
public record UploadStartMessage() implements ProtocolMessage {
    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.UPLOAD_START;
    }

    @Override
    public void write(DataOutputStream out) {
        // empty payload
    }

    public static UploadStartMessage read(DataInputStream in) {
        return new UploadStartMessage();
    }
}
