package io.github.narrowlink.transfer.core.protocol;

import io.github.narrowlink.transfer.core.service.ChecksumService;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Sent by the receiver of an upload once the file is verified and committed under its final name.
 */
public final class UploadCompleteMessage implements ProtocolMessage {
    private final String name;
    private final byte[] digest;

    public UploadCompleteMessage(String name, byte[] digest) {
        this.name = Objects.requireNonNull(name, "name");
        this.digest = digest.clone();
    }

    public String getName() {
        return name;
    }

    public byte[] getDigest() {
        return digest.clone();
    }

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.UPLOAD_COMPLETE;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeString(out, name);
        ProtocolIO.writeDigest(out, digest);
    }

    public static UploadCompleteMessage read(DataInputStream in) throws IOException {
        String name = ProtocolIO.readString(in);
        return new UploadCompleteMessage(name, ProtocolIO.readDigest(in));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UploadCompleteMessage other
                && name.equals(other.name) && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return "UploadCompleteMessage[name=" + name + ", digest=" + ChecksumService.toHex(digest) + "]";
    }
}
