package io.github.narrowlink.transfer.core.util;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PathUtilTest {

    @Test
    void acceptsOrdinaryNames() throws Exception {
        for (String name : new String[]{"a", "report.pdf", "with space.txt", "ünïcödé.md", "x".repeat(255)}) {
            assertEquals(name, PathUtil.requireValidFileName(name));
        }
    }

    @Test
    void rejectsUnsafeNames() {
        String[] names = {"", ".", "..", ".env", "../up", "dir/file", "dir\\file", "nul\0byte", "x".repeat(256)};
        for (String name : names) {
            ProtocolException e = assertThrows(ProtocolException.class, () -> PathUtil.requireValidFileName(name));
            assertEquals(ErrorKind.INVALID_FILENAME, e.kind());
            assertFalse(PathUtil.isValidFileName(name));
        }
        assertFalse(PathUtil.isValidFileName(null));
    }

    @Test
    void lengthLimitCountsUtf8Bytes() {
        // 128 two-byte characters
        assertFalse(PathUtil.isValidFileName("é".repeat(128)));
        assertTrue(PathUtil.isValidFileName("é".repeat(127)));
    }

    @Test
    void resolvesInsideRoot() throws Exception {
        Path root = Path.of("storage").toAbsolutePath().normalize();
        assertEquals(root.resolve("file.txt"), PathUtil.resolveWithin(Path.of("storage"), "file.txt"));
    }
}
