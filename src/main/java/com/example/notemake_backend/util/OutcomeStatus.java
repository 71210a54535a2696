package com.example.notemake_backend.util;

/**
 * Terminal status of one video run through the pipeline.
 */
public enum OutcomeStatus {
    SUCCESS,
    PARTIAL,
    FAILED
}
