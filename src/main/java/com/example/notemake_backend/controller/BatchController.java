package com.example.notemake_backend.controller;

import com.example.notemake_backend.dto.pipeline.BatchRun;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.web.BatchRequest;
import com.example.notemake_backend.dto.web.BatchResponse;
import com.example.notemake_backend.dto.web.BatchStatusResponse;
import com.example.notemake_backend.dto.web.NoteOptionsRequest;
import com.example.notemake_backend.dto.web.NoteRequest;
import com.example.notemake_backend.service.batch.BatchCoordinator;
import com.example.notemake_backend.service.batch.BatchOrganizer;
import com.example.notemake_backend.service.batch.BatchPlan;
import com.example.notemake_backend.service.batch.BatchRegistry;
import com.example.notemake_backend.service.batch.LoggingProgressReporter;
import com.example.notemake_backend.util.UrlListParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/batches")
public class BatchController {

    private final BatchCoordinator coordinator;
    private final BatchRegistry registry;
    private final BatchOrganizer organizer;
    private final LoggingProgressReporter reporter;

    public BatchController(BatchCoordinator coordinator, BatchRegistry registry, BatchOrganizer organizer,
                           LoggingProgressReporter reporter) {
        this.coordinator = coordinator;
        this.registry = registry;
        this.organizer = organizer;
        this.reporter = reporter;
    }

    /**
     * Validates and expands the inputs synchronously, then runs the batch in the background.
     */
    @Operation(summary = "Start a batch over video, playlist and channel URLs")
    @ApiResponse(responseCode = "202", description = "Batch accepted; poll GET /v1/batches/{id}")
    @ApiResponse(responseCode = "400", description = "No valid URLs in the request")
    @ApiResponse(responseCode = "502", description = "A playlist or channel could not be resolved")
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public BatchResponse submit(@Valid @RequestBody BatchRequest request) {
        List<String> inputs = new ArrayList<>();
        if (request.urls() != null) {
            inputs.addAll(request.urls());
        }
        inputs.addAll(UrlListParser.parse(request.urlListText()));
        UrlListParser.Validation validation = UrlListParser.validate(inputs);
        if (validation.valid().isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "NO_VALID_URLS");
        }
        BatchPlan plan = coordinator.expand(validation.valid(), request.language(), NoteRequest.parseMode(request.mode()),
                request.maxVideos());
        BatchRun run = coordinator.submit(plan, request.concurrency(), NoteOptionsRequest.toOptions(request.options()), reporter);
        return new BatchResponse(run.getId(), run.size(), validation.invalid());
    }

    @GetMapping("/{id}")
    public BatchStatusResponse get(@PathVariable String id,
                                   @RequestParam(name = "groupBy", required = false) String groupBy) {
        BatchRun run = registry.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "BATCH_NOT_FOUND"));
        Map<String, List<PipelineOutcome>> groups = null;
        if (groupBy != null && !groupBy.isBlank()) {
            groups = organizer.organize(run.getOutcomes(), BatchOrganizer.GroupBy.parse(groupBy));
        }
        return BatchStatusResponse.from(run, groups);
    }

    @PostMapping("/{id}/cancel")
    public BatchStatusResponse cancel(@PathVariable String id) {
        BatchRun run = registry.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "BATCH_NOT_FOUND"));
        if (!coordinator.cancel(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "BATCH_ALREADY_FINISHED");
        }
        return BatchStatusResponse.from(run, null);
    }
}
