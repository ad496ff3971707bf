package io.github.narrowlink.transfer.core.service;

import io.github.narrowlink.transfer.core.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.time.Duration;

/**
 * Reconnect-and-restart: runs a whole client operation again after a retryable failure.
 * The wire protocol has no resume, so each attempt starts from scratch on a new connection.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T run() throws IOException;
    }

    private final int maxAttempts;
    private final Duration backoff;

    public RetryPolicy(int maxAttempts, Duration backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public <T> T execute(String operation, Attempt<T> attempt) throws IOException {
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (IOException e) {
                if (i >= maxAttempts || !isRetryable(e)) {
                    throw e;
                }
                log.warn("{} failed (attempt {} of {}): {}. Retrying in {} ms", operation, i, maxAttempts,
                        e.getMessage(), backoff.toMillis());
                sleep(operation);
            }
        }
    }

    /**
     * Protocol errors follow their kind. Local file problems and wrapped non-I/O failures come back
     * the same on every attempt; other I/O failures are treated as transient.
     */
    public static boolean isRetryable(IOException error) {
        if (error instanceof ProtocolException protocolException) {
            return protocolException.kind().isRetryable();
        }
        if (error instanceof NoSuchFileException || error instanceof AccessDeniedException) {
            return false;
        }
        Throwable cause = error.getCause();
        return cause == null || cause instanceof IOException;
    }

    private void sleep(String operation) throws IOException {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while retrying " + operation, e);
        }
    }
}
