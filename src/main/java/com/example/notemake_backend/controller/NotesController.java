package com.example.notemake_backend.controller;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.web.NoteOptionsRequest;
import com.example.notemake_backend.dto.web.NoteRequest;
import com.example.notemake_backend.service.PipelineOrchestrator;
import com.example.notemake_backend.service.export.ExportFormat;
import com.example.notemake_backend.service.export.ExportOptions;
import com.example.notemake_backend.service.export.ExportService;
import com.example.notemake_backend.service.export.ExportedNote;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/v1/notes")
public class NotesController {

    private final PipelineOrchestrator orchestrator;
    private final ExportService exportService;

    public NotesController(PipelineOrchestrator orchestrator, ExportService exportService) {
        this.orchestrator = orchestrator;
        this.exportService = exportService;
    }

    /**
     * Runs the pipeline for one video. Always 200 with the outcome; a failed video is reported in the body.
     */
    @Operation(summary = "Extract, process and summarize one video")
    @ApiResponse(responseCode = "200", description = "Pipeline finished; check status for per-video failures")
    @ApiResponse(responseCode = "400", description = "Not a video URL or id")
    @PostMapping
    public PipelineOutcome create(@Valid @RequestBody NoteRequest request) {
        return orchestrator.run(request.toVideoRef(), NoteOptionsRequest.toOptions(request.options()));
    }

    @Operation(summary = "Run the pipeline and download the notes as Markdown, JSON or PDF")
    @ApiResponse(responseCode = "422", description = "No transcript could be produced")
    @PostMapping("/export")
    public ResponseEntity<byte[]> export(@Valid @RequestBody NoteRequest request,
                                         @RequestParam(name = "format", defaultValue = "markdown") String format,
                                         @RequestParam(name = "timestamps", defaultValue = "true") boolean timestamps,
                                         @RequestParam(name = "clickable", defaultValue = "true") boolean clickable,
                                         @RequestParam(name = "groupBySeconds", defaultValue = "0") int groupBySeconds,
                                         @RequestParam(name = "tags", defaultValue = "false") boolean tags) {
        ExportFormat exportFormat = ExportFormat.parse(format);
        PipelineOutcome outcome = orchestrator.run(request.toVideoRef(), NoteOptionsRequest.toOptions(request.options()));
        if (outcome.transcript() == null) {
            String reason = outcome.error() != null ? outcome.error().kind() + ": " + outcome.error().message() : "NO_TRANSCRIPT";
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, reason);
        }
        ExportOptions options = new ExportOptions(timestamps, clickable, groupBySeconds, true, true, tags, true, true);
        ExportedNote note = exportService.export(outcome, exportFormat, options);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(note.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(note.fileName(), StandardCharsets.UTF_8).build().toString())
                .body(note.content());
    }
}
