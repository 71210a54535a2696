package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON document with {@code metadata}, {@code video_info}, {@code transcript} and, when present,
 * {@code statistics}, {@code processed} and {@code ai_summary}. Segment offsets are in seconds.
 */
@Component
public class JsonExporter implements NoteExporter {

    private final ObjectMapper mapper;
    private final Clock clock;

    public JsonExporter(ObjectMapper objectMapper, Clock clock) {
        this.mapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public byte[] export(PipelineOutcome outcome, ExportOptions options) throws IOException {
        return mapper.writeValueAsBytes(document(outcome));
    }

    Map<String, Object> document(PipelineOutcome outcome) {
        Map<String, Object> doc = new LinkedHashMap<>();
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("export_date", clock.instant().toString());
        meta.put("exporter", "notemake-backend");
        meta.put("status", outcome.status().name());
        meta.put("source_mode", outcome.transcript().sourceMode().name());
        meta.put("language", outcome.transcript().language());
        meta.put("from_cache", outcome.fromCache());
        doc.put("metadata", meta);
        doc.put("video_info", ExportSupport.metadata(outcome));

        List<Map<String, Object>> transcript = new ArrayList<>();
        for (TranscriptSegment s : outcome.transcript().segments()) {
            Map<String, Object> seg = new LinkedHashMap<>();
            seg.put("start", s.startSec());
            seg.put("duration", s.durationMs() / 1000.0);
            seg.put("text", s.text());
            transcript.add(seg);
        }
        doc.put("transcript", transcript);

        if (outcome.processedText() != null) {
            doc.put("statistics", outcome.processedText().statistics());
            Map<String, Object> processed = new LinkedHashMap<>();
            processed.put("paragraphs", outcome.processedText().paragraphs());
            processed.put("keywords", outcome.processedText().keywords());
            processed.put("summary_points", outcome.processedText().summaryPoints());
            doc.put("processed", processed);
        }
        if (outcome.summary() != null) {
            doc.put("ai_summary", outcome.summary());
        }
        if (outcome.error() != null) {
            doc.put("error", outcome.error());
        }
        return doc;
    }
}
