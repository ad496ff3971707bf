package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.protocol.ErrorKind;
import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1));

    @Test
    void retriesRetryableKindsUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String result = policy.execute("download", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ProtocolException(ErrorKind.CHECKSUM_MISMATCH, "bad digest");
            }
            return "ok";
        });
        assertEquals("ok", result);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        ProtocolException e = assertThrows(ProtocolException.class, () -> policy.execute("upload", () -> {
            calls.incrementAndGet();
            throw new ProtocolException(ErrorKind.TIMEOUT, "slow");
        }));
        assertEquals(ErrorKind.TIMEOUT, e.kind());
        assertEquals(3, calls.get());
    }

    @Test
    void doesNotRetryTerminalKinds() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(ProtocolException.class, () -> policy.execute("download", () -> {
            calls.incrementAndGet();
            throw new ProtocolException(ErrorKind.FILE_NOT_FOUND, "gone");
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void retriesPlainIoFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Integer result = policy.execute("list", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConnectException("refused");
            }
            return 7;
        });
        assertEquals(7, result);
        assertEquals(2, calls.get());
    }

    @Test
    void missingLocalSourceFailsOnFirstAttempt(@TempDir Path dir) {
        AtomicInteger calls = new AtomicInteger();
        Path missing = dir.resolve("typo.bin");
        assertThrows(NoSuchFileException.class, () -> policy.execute("upload " + missing, () -> {
            calls.incrementAndGet();
            return Files.size(missing);
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void wrappedNonIoFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(IOException.class, () -> policy.execute("download", () -> {
            calls.incrementAndGet();
            throw new IOException(new IllegalStateException("Session busy"));
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void localFileErrorsAreTerminal() {
        assertFalse(RetryPolicy.isRetryable(new NoSuchFileException("a.bin")));
        assertFalse(RetryPolicy.isRetryable(new AccessDeniedException("a.bin")));
        assertTrue(RetryPolicy.isRetryable(new IOException("reset", new ConnectException("refused"))));
    }

    @Test
    void classifiesRetryableErrors() {
        assertTrue(RetryPolicy.isRetryable(new IOException("reset")));
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind.isRetryable(), RetryPolicy.isRetryable(new ProtocolException(kind, "x")), kind.name());
        }
        assertTrue(ErrorKind.TRUNCATED.isRetryable());
        assertFalse(ErrorKind.PROTOCOL_VIOLATION.isRetryable());
    }

    @Test
    void rejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO));
    }
}
