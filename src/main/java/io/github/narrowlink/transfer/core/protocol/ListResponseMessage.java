package io.github.narrowlink.transfer.core.protocol;

import io.github.narrowlink.transfer.core.model.FileEntry;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record ListResponseMessage(List<FileEntry> entries) implements ProtocolMessage {
    public ListResponseMessage {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public ProtocolMessageType type() {
        return ProtocolMessageType.LIST_RESPONSE;
    }

    @Override
    public void write(DataOutputStream out) throws IOException {
        ProtocolIO.writeUnsignedInt(out, entries.size());
        for (FileEntry entry : entries) {
            ProtocolIO.writeString(out, entry.name());
            out.writeLong(entry.size());
            out.writeLong(entry.modifiedMillis());
        }
    }

    public static ListResponseMessage read(DataInputStream in) throws IOException {
        long count = ProtocolIO.readUnsignedInt(in);
        List<FileEntry> entries = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            String name = ProtocolIO.readString(in);
            long size = in.readLong();
            long modified = in.readLong();
            entries.add(new FileEntry(name, size, modified));
        }
        return new ListResponseMessage(Collections.unmodifiableList(entries));
    }
}
