package io.github.narrowlink.transfer.core.util;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * File name rules for names that arrive over the wire. A valid name is a single path segment,
 * so it can never escape the storage root.
 */
public final class PathUtil {
    private static final int MAX_NAME_BYTES = 255;

    private PathUtil() {
    }

    /**
     * @throws ProtocolException {@code INVALID_FILENAME} for empty, overlong, hidden, dot or
     *                           separator-bearing names
     */
    public static String requireValidFileName(String name) throws ProtocolException {
        if (name == null || name.isEmpty()) {
            throw invalid(name, "empty name");
        }
        if (name.getBytes(StandardCharsets.UTF_8).length > MAX_NAME_BYTES) {
            throw invalid(name, "longer than " + MAX_NAME_BYTES + " bytes");
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw invalid(name, "contains a path separator");
        }
        // also rejects "." and ".."
        if (name.startsWith(".")) {
            throw invalid(name, "dot names are reserved");
        }
        return name;
    }

    public static boolean isValidFileName(String name) {
        try {
            requireValidFileName(name);
            return true;
        } catch (ProtocolException e) {
            return false;
        }
    }

    /**
     * Resolves a validated name inside {@code root}.
     */
    public static Path resolveWithin(Path root, String name) throws ProtocolException {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path target = normalizedRoot.resolve(requireValidFileName(name)).normalize();
        if (!target.startsWith(normalizedRoot) || target.equals(normalizedRoot)) {
            throw invalid(name, "resolves outside the storage root");
        }
        return target;
    }

    private static ProtocolException invalid(String name, String reason) {
        return new ProtocolException(ErrorKind.INVALID_FILENAME, "Invalid file name '" + name + "': " + reason);
    }
}
