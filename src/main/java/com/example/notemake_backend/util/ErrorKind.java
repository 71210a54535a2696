package com.example.notemake_backend.util;

/**
 * Failure taxonomy shared by collaborators, the pipeline and the REST layer.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_REFERENCE,
    NO_CAPTIONS,
    NETWORK,
    TIMEOUT,
    RESOURCE_EXHAUSTED,
    MODEL_ERROR,
    EXTRACTION_FAILED,
    PROVIDER_ERROR,
    QUOTA_EXCEEDED,
    STORAGE_UNAVAILABLE,
    PLAYLIST_RESOLUTION_FAILED,
    PROCESSING_FAILED,
    CANCELLED;

    /**
     * Transient failures are retried with backoff; everything else is decided on the first attempt.
     */
    public boolean isTransient() {
        return this == NETWORK || this == TIMEOUT;
    }
}
