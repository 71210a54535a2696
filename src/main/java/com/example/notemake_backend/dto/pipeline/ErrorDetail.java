package com.example.notemake_backend.dto.pipeline;

import com.example.notemake_backend.exception.ExtractionFailedException;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.util.ErrorKind;

/**
 * Failure description carried by an outcome.
 *
 * @param kind      what failed.
 * @param causeKind underlying failure when {@code kind} wraps another one (e.g. extraction failed because of
 *                  resource exhaustion); equal to {@code kind} otherwise.
 * @param stage     pipeline stage that produced the failure.
 */
public record ErrorDetail(ErrorKind kind, ErrorKind causeKind, String stage, String message) {

    public static ErrorDetail of(String stage, PipelineException ex) {
        ErrorKind cause = ex instanceof ExtractionFailedException efe ? efe.getCauseKind() : ex.getKind();
        return new ErrorDetail(ex.getKind(), cause, stage, ex.getMessage());
    }

    public static ErrorDetail of(ErrorKind kind, String stage, String message) {
        return new ErrorDetail(kind, kind, stage, message);
    }
}
