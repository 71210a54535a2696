package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

final class ExportSupport {
    private static final Pattern ARTIFACTS = Pattern.compile("\\[(Music|Applause|Laughter)]");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private ExportSupport() {
    }

    static VideoMetadata metadata(PipelineOutcome outcome) {
        VideoMetadata md = outcome.transcript() != null ? outcome.transcript().metadata() : null;
        return md != null ? md : VideoMetadata.empty(outcome.videoRef().videoId(), outcome.videoRef().watchUrl());
    }

    static String clean(String text) {
        if (text == null) return "";
        String t = ARTIFACTS.matcher(text).replaceAll("");
        return SPACES.matcher(t).replaceAll(" ").trim();
    }

    /**
     * Consecutive segments whose start falls in the same {@code seconds}-wide window.
     */
    static List<Block> blocks(List<TranscriptSegment> segments, int seconds) {
        List<Block> out = new ArrayList<>();
        long windowMs = seconds * 1000L;
        long currentStart = -1;
        StringBuilder text = new StringBuilder();
        for (TranscriptSegment s : segments) {
            long start = (s.startMs() / windowMs) * windowMs;
            if (start != currentStart && text.length() > 0) {
                out.add(new Block(currentStart / 1000.0, clean(text.toString())));
                text.setLength(0);
            }
            currentStart = start;
            text.append(s.text()).append(' ');
        }
        if (text.length() > 0) {
            out.add(new Block(currentStart / 1000.0, clean(text.toString())));
        }
        return out;
    }

    record Block(double startSec, String text) {
    }
}
