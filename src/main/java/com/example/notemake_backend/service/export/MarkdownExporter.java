package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.Chapter;
import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.Summary;
import com.example.notemake_backend.dto.pipeline.TextStatistics;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.util.TimeFormat;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class MarkdownExporter implements NoteExporter {
    private static final DateTimeFormatter FOOTER_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int MAX_TAGS = 10;

    private final Clock clock;

    public MarkdownExporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public byte[] export(PipelineOutcome outcome, ExportOptions options) {
        return render(outcome, options).getBytes(StandardCharsets.UTF_8);
    }

    public String render(PipelineOutcome outcome, ExportOptions options) {
        ExportOptions opts = options != null ? options : ExportOptions.defaults();
        VideoMetadata md = ExportSupport.metadata(outcome);
        String videoId = outcome.videoRef().videoId();
        List<String> out = new ArrayList<>();

        out.add("# " + md.displayTitle() + "\n");

        Summary summary = outcome.summary();
        if (summary != null && summary.summary() != null && !summary.summary().isBlank()) {
            out.add("## Summary\n");
            out.add(summary.summary() + "\n");
            if (!summary.keyPoints().isEmpty()) {
                out.add("### Key Points\n");
                summary.keyPoints().forEach(p -> out.add("- " + p));
                out.add("");
            }
            if (!summary.questions().isEmpty()) {
                out.add("### Questions\n");
                summary.questions().forEach(q -> out.add("- " + q));
                out.add("");
            }
        }

        out.add("## Video Information\n");
        out.add("- **Channel**: " + orUnknown(md.channel()));
        out.add("- **Upload Date**: " + (md.publishedAt() == null ? "Unknown" : md.publishedAt().toString()));
        if (md.durationSec() != null && md.durationSec() > 0) {
            out.add("- **Duration**: " + TimeFormat.duration(md.durationSec()));
        }
        if (md.viewCount() != null && md.viewCount() > 0) {
            out.add("- **Views**: " + String.format(Locale.US, "%,d", md.viewCount()));
        }
        if (md.likeCount() != null && md.likeCount() > 0) {
            out.add("- **Likes**: " + String.format(Locale.US, "%,d", md.likeCount()));
        }
        String url = md.url() != null ? md.url() : outcome.videoRef().watchUrl();
        out.add("- **URL**: [" + url + "](" + url + ")");
        out.add("- **Transcript Source**: " + outcome.transcript().sourceMode());

        if (opts.includeTags() && !md.tags().isEmpty()) {
            out.add("\n**Tags**: " + String.join(", ", md.tags().subList(0, Math.min(MAX_TAGS, md.tags().size()))));
        }
        if (opts.includeThumbnail() && md.thumbnail() != null) {
            out.add("\n![Video Thumbnail](" + md.thumbnail() + ")");
        }

        TextStatistics stats = outcome.processedText() != null ? outcome.processedText().statistics() : null;
        if (opts.includeStatistics() && stats != null) {
            out.add("\n## Statistics\n");
            out.add("- **Word Count**: " + String.format(Locale.US, "%,d", stats.wordCount()));
            out.add("- **Character Count**: " + String.format(Locale.US, "%,d", stats.characterCount()));
            out.add("- **Estimated Reading Time**: " + stats.readingMinutesAverage() + " minutes");
            if (stats.speakingRateWpm() != null) {
                out.add("- **Speaking Rate**: " + stats.speakingRateWpm() + " words/minute");
            }
        }

        if (opts.includeToc() && !md.chapters().isEmpty()) {
            out.add("\n## Table of Contents\n");
            int i = 1;
            for (Chapter c : md.chapters()) {
                out.add(i++ + ". [" + TimeFormat.timestamp(c.startSec()) + "](" + TimeFormat.timestampLink(videoId, c.startSec())
                        + ") - " + c.title());
            }
        }
        if (summary != null && !summary.chapterSummaries().isEmpty()) {
            out.add("\n## Chapter Summaries\n");
            for (Map.Entry<String, String> e : summary.chapterSummaries().entrySet()) {
                out.add("### " + e.getKey() + "\n");
                out.add(e.getValue() + "\n");
            }
        }

        if (opts.includeDescription() && md.description() != null && !md.description().isBlank()) {
            out.add("\n## Description\n");
            out.add(md.description());
        }

        out.add("\n## Transcript\n");
        List<TranscriptSegment> segments = outcome.transcript().segments();
        out.add(opts.groupBySeconds() > 0
                ? grouped(segments, videoId, opts)
                : sequential(segments, videoId, opts));

        out.add("\n---\n*Notes generated on " + LocalDateTime.now(clock).format(FOOTER_TIME) + " by notemake-backend*");
        return String.join("\n", out);
    }

    private static String sequential(List<TranscriptSegment> segments, String videoId, ExportOptions opts) {
        List<String> lines = new ArrayList<>(segments.size());
        for (TranscriptSegment s : segments) {
            String text = ExportSupport.clean(s.text());
            if (!opts.includeTimestamps()) {
                lines.add(text);
            } else if (opts.clickableTimestamps()) {
                lines.add("**[" + TimeFormat.timestamp(s.startSec()) + "](" + TimeFormat.timestampLink(videoId, s.startSec()) + ")** " + text);
            } else {
                lines.add("**" + TimeFormat.timestamp(s.startSec()) + "** " + text);
            }
        }
        return String.join("\n\n", lines);
    }

    private static String grouped(List<TranscriptSegment> segments, String videoId, ExportOptions opts) {
        List<String> lines = new ArrayList<>();
        for (ExportSupport.Block block : ExportSupport.blocks(segments, opts.groupBySeconds())) {
            if (opts.includeTimestamps()) {
                String ts = TimeFormat.timestamp(block.startSec());
                lines.add(opts.clickableTimestamps()
                        ? "### [" + ts + "](" + TimeFormat.timestampLink(videoId, block.startSec()) + ")\n"
                        : "### " + ts + "\n");
            }
            lines.add(block.text() + "\n");
        }
        return String.join("\n", lines);
    }

    private static String orUnknown(String s) {
        return s == null || s.isBlank() ? "Unknown" : s;
    }
}
