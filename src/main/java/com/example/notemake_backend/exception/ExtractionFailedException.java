package com.example.notemake_backend.exception;

import com.example.notemake_backend.util.ErrorKind;

/**
 * Terminal failure of the extraction state machine. {@link #getCauseKind()} names what went wrong
 * underneath (model error, resource exhaustion, missing captions on a pinned mode, ...).
 */
public class ExtractionFailedException extends PipelineException {

    private final ErrorKind causeKind;

    public ExtractionFailedException(String message, PipelineException cause) {
        super(ErrorKind.EXTRACTION_FAILED, message, cause);
        this.causeKind = cause != null ? cause.getKind() : ErrorKind.EXTRACTION_FAILED;
    }

    public ErrorKind getCauseKind() {
        return causeKind;
    }
}
