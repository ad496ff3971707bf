package io.github.narrowlink.transfer.core.model;

import java.util.EnumSet;
import java.util.Set;

public enum TransferState {
    IDLE,
    HANDSHAKING,
    READY,
    DOWNLOADING,
    UPLOADING,
    VERIFYING,
    COMPLETE,
    FAILED;

    public boolean canMoveTo(TransferState next) {
        return successors().contains(next);
    }

    /**
     * READY and COMPLETE both accept a new request on the same connection.
     */
    public boolean acceptsRequests() {
        return this == READY || this == COMPLETE;
    }

    private Set<TransferState> successors() {
        return switch (this) {
            case IDLE -> EnumSet.of(HANDSHAKING, FAILED);
            case HANDSHAKING -> EnumSet.of(READY, IDLE, FAILED);
            case READY, COMPLETE -> EnumSet.of(DOWNLOADING, UPLOADING, READY, FAILED);
            // READY: the requested file was refused before any metadata
            case DOWNLOADING -> EnumSet.of(VERIFYING, COMPLETE, READY, FAILED);
            case UPLOADING -> EnumSet.of(VERIFYING, FAILED);
            case VERIFYING -> EnumSet.of(COMPLETE, FAILED);
            case FAILED -> EnumSet.noneOf(TransferState.class);
        };
    }
}
