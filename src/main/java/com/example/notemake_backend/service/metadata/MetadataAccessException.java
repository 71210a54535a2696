package com.example.notemake_backend.service.metadata;

import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;

public class MetadataAccessException extends PipelineException {

    public MetadataAccessException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
