package com.example.notemake_backend.exception;

import com.example.notemake_backend.util.ErrorKind;

/**
 * The cache medium cannot be read or written. Callers continue without the cache.
 */
public class StorageUnavailableException extends PipelineException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}
