package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;

import java.io.IOException;

/**
 * Renders a finished outcome into one document format. Callers guarantee the outcome carries a transcript.
 */
public interface NoteExporter {

    ExportFormat format();

    byte[] export(PipelineOutcome outcome, ExportOptions options) throws IOException;
}
