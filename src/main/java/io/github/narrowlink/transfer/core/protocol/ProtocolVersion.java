package io.github.narrowlink.transfer.core.protocol;

import java.util.Set;

public final class ProtocolVersion {
    public static final int CURRENT = 1;
    private static final Set<Integer> SUPPORTED = Set.of(CURRENT);

    private ProtocolVersion() {
    }

    public static boolean isSupported(int version) {
        return SUPPORTED.contains(version);
    }
}
