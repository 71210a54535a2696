package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.ErrorDetail;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.ErrorKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportServiceTest {

    private final ExportService service = new ExportService(List.of(
            new MarkdownExporter(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC))));

    @Test
    void fileNameComesFromSanitizedTitle() {
        ExportedNote note = service.export(Transcripts.fullOutcome("dQw4w9WgXcQ"), ExportFormat.MARKDOWN, null);

        assertThat(note.fileName()).isEqualTo("Caching_Deep_Dive.md");
        assertThat(note.contentType()).isEqualTo("text/markdown");
        assertThat(new String(note.content(), StandardCharsets.UTF_8)).startsWith("# Caching Deep Dive");
    }

    @Test
    void sanitizeStripsReservedCharactersAndCapsLength() {
        assertThat(ExportService.sanitizeFileName("a/b: c?*")).isEqualTo("ab_c");
        assertThat(ExportService.sanitizeFileName("  ")).isEqualTo("notes");
        assertThat(ExportService.sanitizeFileName("x".repeat(150))).hasSize(100);
    }

    @Test
    void failedOutcomeCannotBeExported() {
        PipelineOutcome failed = PipelineOutcome.failed(VideoRef.of("abc123"),
                ErrorDetail.of(ErrorKind.NOT_FOUND, "METADATA", "gone"), Instant.EPOCH);

        assertThatThrownBy(() -> service.export(failed, ExportFormat.MARKDOWN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingExporterIsRejected() {
        assertThatThrownBy(() -> service.export(Transcripts.fullOutcome("dQw4w9WgXcQ"), ExportFormat.PDF, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatParsingAcceptsNamesAndExtensions() {
        assertThat(ExportFormat.parse("md")).isEqualTo(ExportFormat.MARKDOWN);
        assertThat(ExportFormat.parse("JSON")).isEqualTo(ExportFormat.JSON);
        assertThat(ExportFormat.parse(null)).isEqualTo(ExportFormat.MARKDOWN);
        assertThatThrownBy(() -> ExportFormat.parse("docx")).isInstanceOf(IllegalArgumentException.class);
    }
}
