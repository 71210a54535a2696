package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.VideoRef;
import com.example.notemake_backend.support.Transcripts;
import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.OutcomeStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownExporterTest {

    private final MarkdownExporter exporter =
            new MarkdownExporter(Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void fullNotesContainAllSections() {
        String md = exporter.render(Transcripts.fullOutcome("dQw4w9WgXcQ"), ExportOptions.defaults());

        assertThat(md).startsWith("# Caching Deep Dive\n");
        assertThat(md).contains("## Summary", "### Key Points", "- Entries live thirty days", "### Questions",
                "- Why expire entries?");
        assertThat(md).contains("- **Channel**: Backend Weekly", "- **Duration**: 10m 0s", "- **Views**: 12,345",
                "- **Transcript Source**: CAPTIONS");
        assertThat(md).contains("## Statistics", "## Description", "A talk about caches.");
        assertThat(md).contains("1. [00:00](https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=0s) - Intro",
                "2. [00:08](https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=8s) - Expiry");
        assertThat(md).contains("## Chapter Summaries", "### Intro");
        assertThat(md).contains("**[00:00](https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=0s)** welcome to the channel");
        assertThat(md).doesNotContain("**Tags**");
        assertThat(md).endsWith("*Notes generated on 2024-05-01 10:00:00 by notemake-backend*");
    }

    @Test
    void artifactsAreStrippedFromTranscriptLines() {
        String md = exporter.render(Transcripts.fullOutcome("dQw4w9WgXcQ"), ExportOptions.defaults());

        assertThat(md).contains("** and then it is fetched again.");
        assertThat(md.substring(md.indexOf("## Transcript"))).doesNotContain("[Music]");
    }

    @Test
    void groupedTranscriptUsesTimeWindows() {
        ExportOptions options = new ExportOptions(true, false, 10, false, false, true, false, false);

        String md = exporter.render(Transcripts.fullOutcome("dQw4w9WgXcQ"), options);

        String transcript = md.substring(md.indexOf("## Transcript"));
        assertThat(transcript).contains("### 00:00\n", "### 00:10\n");
        assertThat(transcript).contains("welcome to the channel today we talk about caching strategies. a cache entry expires");
        assertThat(md).contains("**Tags**: cache, java");
        assertThat(md).doesNotContain("## Statistics", "## Table of Contents", "![Video Thumbnail]");
    }

    @Test
    void plainTranscriptWithoutTimestampsOrMetadata() {
        TranscriptResult transcript = Transcripts.sample(ExtractionMode.AUDIO);
        PipelineOutcome bare = new PipelineOutcome(VideoRef.of("abc123"), OutcomeStatus.SUCCESS, transcript, null,
                null, null, true, Instant.EPOCH);

        String md = exporter.render(bare, new ExportOptions(false, false, 0, true, true, true, true, true));

        assertThat(md).startsWith("# abc123\n");
        assertThat(md).contains("- **Channel**: Unknown", "- **Transcript Source**: AUDIO");
        assertThat(md).contains("welcome to the channel\n\ntoday we talk about caching strategies.");
        assertThat(md).doesNotContain("## Summary", "## Statistics");
    }
}
