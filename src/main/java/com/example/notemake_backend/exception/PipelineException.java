package com.example.notemake_backend.exception;

import com.example.notemake_backend.util.ErrorKind;

/**
 * Base failure raised by collaborators and pipeline stages. The {@link ErrorKind} decides whether the
 * caller retries, falls back, degrades or fails the item.
 */
public class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    public PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    public String getErrorCode() {
        return kind.name();
    }
}
