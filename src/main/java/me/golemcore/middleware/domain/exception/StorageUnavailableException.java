package me.golemcore.middleware.domain.exception;

import me.golemcore.middleware.domain.model.FaultKind;

/**
 * Thrown by an event storage backend that cannot accept or serve entries.
 * The event logger absorbs it and degrades to its fallback sink.
 */
public class StorageUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public FaultKind getFaultKind() {
        return FaultKind.STORAGE_UNAVAILABLE;
    }
}
