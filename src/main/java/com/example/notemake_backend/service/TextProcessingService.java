package com.example.notemake_backend.service;

import com.example.notemake_backend.dto.pipeline.Chapter;
import com.example.notemake_backend.dto.pipeline.ChapterSection;
import com.example.notemake_backend.dto.pipeline.Keyword;
import com.example.notemake_backend.dto.pipeline.ProcessedText;
import com.example.notemake_backend.dto.pipeline.ProcessingOptions;
import com.example.notemake_backend.dto.pipeline.TextStatistics;
import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.util.TranscriptSegments;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a raw transcript into readable text: paragraphs, cleanup, keywords, extractive summary points, statistics
 * and per-chapter sections. Pure in-memory work.
 */
@Service
public class TextProcessingService {

    static final List<String> FILLER_WORDS = List.of(
            "um", "uh", "ah", "er", "like", "you know", "I mean",
            "sort of", "kind of", "basically", "actually", "literally");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "were", "been",
            "be", "have", "has", "had", "do", "does", "did", "will", "would",
            "could", "should", "may", "might", "can", "this", "that", "these",
            "those", "i", "you", "he", "she", "it", "we", "they", "what", "which",
            "who", "when", "where", "why", "how", "so", "than", "too", "very");

    private static final Pattern ARTIFACTS = Pattern.compile("\\[(?:music|applause|laughter)]|♪+", Pattern.CASE_INSENSITIVE);
    private static final Pattern MULTI_SPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_\\s]");
    private static final int MIN_SUMMARY_SENTENCE = 20;

    public ProcessedText process(TranscriptResult transcript, ProcessingOptions options) {
        ProcessingOptions opts = options != null ? options : ProcessingOptions.defaults();
        List<TranscriptSegment> segments = transcript.segments();

        List<String> paragraphs = new ArrayList<>();
        for (List<TranscriptSegment> group : groupParagraphs(segments, opts)) {
            String p = clean(TranscriptSegments.fullText(group), opts);
            if (!p.isBlank()) {
                paragraphs.add(p);
            }
        }
        String text = String.join("\n\n", paragraphs);

        Long duration = transcript.metadata() != null ? transcript.metadata().durationSec() : null;
        if (duration == null || duration <= 0) {
            long endMs = TranscriptSegments.endMs(segments);
            duration = endMs > 0 ? (endMs + 999) / 1000 : null;
        }

        List<Chapter> chapters = transcript.metadata() != null ? transcript.metadata().chapters() : List.of();
        return new ProcessedText(
                text,
                paragraphs,
                extractKeywords(text, opts.keywordCount()),
                summaryPoints(text, opts.summaryPoints()),
                statistics(text, duration),
                chapterSections(segments, chapters, opts)
        );
    }

    List<List<TranscriptSegment>> groupParagraphs(List<TranscriptSegment> segments, ProcessingOptions opts) {
        List<List<TranscriptSegment>> groups = new ArrayList<>();
        if (segments.isEmpty()) {
            return groups;
        }
        if (!opts.detectParagraphs()) {
            groups.add(segments);
            return groups;
        }
        long pauseMs = Math.round(opts.paragraphPauseSec() * 1000);
        List<TranscriptSegment> current = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            TranscriptSegment seg = segments.get(i);
            current.add(seg);
            boolean last = i == segments.size() - 1;
            if (last || segments.get(i + 1).startMs() - seg.endMs() >= pauseMs) {
                groups.add(current);
                current = new ArrayList<>();
            }
        }
        return groups;
    }

    String clean(String text, ProcessingOptions opts) {
        String out = text;
        if (opts.cleanArtifacts()) {
            out = ARTIFACTS.matcher(out).replaceAll(" ");
        }
        if (opts.removeFillers()) {
            out = removeFillers(out, opts.customFillers());
        }
        out = MULTI_SPACE.matcher(out).replaceAll(" ").strip();
        if (opts.fixCapitalization()) {
            out = fixCapitalization(out);
        }
        if (opts.improvePunctuation()) {
            out = improvePunctuation(out);
        }
        return out;
    }

    static String removeFillers(String text, List<String> custom) {
        List<String> fillers = new ArrayList<>(FILLER_WORDS);
        fillers.addAll(custom);
        String out = text;
        for (String filler : fillers) {
            if (filler == null || filler.isBlank()) continue;
            Pattern p = Pattern.compile("\\b" + Pattern.quote(filler.strip()) + "\\b,?", Pattern.CASE_INSENSITIVE);
            out = p.matcher(out).replaceAll("");
        }
        return MULTI_SPACE.matcher(out).replaceAll(" ").strip();
    }

    static String fixCapitalization(String text) {
        StringBuilder sb = new StringBuilder(text);
        boolean capitalizeNext = true;
        for (int i = 0; i < sb.length(); i++) {
            char c = sb.charAt(i);
            if (capitalizeNext && Character.isLetter(c)) {
                sb.setCharAt(i, Character.toUpperCase(c));
                capitalizeNext = false;
            } else if (capitalizeNext && Character.isDigit(c)) {
                capitalizeNext = false;
            } else if ((c == '.' || c == '!' || c == '?')
                    && (i + 1 == sb.length() || Character.isWhitespace(sb.charAt(i + 1)))) {
                capitalizeNext = true;
            }
        }
        return sb.toString();
    }

    static String improvePunctuation(String text) {
        if (text.isEmpty()) return text;
        String out = text;
        out = out.replaceAll("([.!?,;:])([A-Za-z])", "$1 $2");
        out = out.replaceAll("\\s+([.!?,;:])", "$1");
        out = out.replaceAll("([.!?]){2,}", "$1");
        char last = out.charAt(out.length() - 1);
        if (last != '.' && last != '!' && last != '?') {
            out = out + ".";
        }
        return out;
    }

    List<Keyword> extractKeywords(String text, int topN) {
        if (topN <= 0 || text.isBlank()) return List.of();
        String normalized = NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String w : MULTI_SPACE.split(normalized)) {
            if (w.length() > 3 && !STOP_WORDS.contains(w)) {
                counts.merge(w, 1, Integer::sum);
            }
        }
        // stable on ties: first occurrence wins
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(topN)
                .map(e -> new Keyword(e.getKey(), e.getValue()))
                .toList();
    }

    List<String> summaryPoints(String text, int count) {
        if (count <= 0) return List.of();
        List<String> sentences = new ArrayList<>();
        for (String s : SENTENCE_SPLIT.split(text)) {
            String t = MULTI_SPACE.matcher(s).replaceAll(" ").strip();
            if (t.length() > MIN_SUMMARY_SENTENCE) sentences.add(t);
        }
        if (sentences.size() <= count) return sentences;
        List<String> picked = new ArrayList<>(count);
        double step = sentences.size() / (double) count;
        for (int i = 0; i < count; i++) {
            picked.add(sentences.get((int) (i * step)));
        }
        return picked;
    }

    TextStatistics statistics(String text, Long durationSec) {
        String trimmed = text.strip();
        int words = trimmed.isEmpty() ? 0 : MULTI_SPACE.split(trimmed).length;
        int sentences = 0;
        for (String s : SENTENCE_SPLIT.split(text)) {
            if (!s.isBlank()) sentences++;
        }
        Double rate = durationSec != null && durationSec > 0 ? round1(words / (double) durationSec * 60) : null;
        return new TextStatistics(
                words,
                text.length(),
                text.replace(" ", "").length(),
                sentences,
                round1(words / 250.0),
                round1(words / 225.0),
                round1(words / 200.0),
                rate
        );
    }

    List<ChapterSection> chapterSections(List<TranscriptSegment> segments, List<Chapter> chapters, ProcessingOptions opts) {
        List<ChapterSection> out = new ArrayList<>();
        for (int i = 0; i < chapters.size(); i++) {
            Chapter ch = chapters.get(i);
            double end = ch.endSec() > ch.startSec() ? ch.endSec()
                    : (i + 1 < chapters.size() ? chapters.get(i + 1).startSec() : Double.MAX_VALUE);
            List<TranscriptSegment> inside = new ArrayList<>();
            for (TranscriptSegment seg : segments) {
                double start = seg.startSec();
                if (start >= ch.startSec() && start < end) inside.add(seg);
            }
            String text = clean(TranscriptSegments.fullText(inside), opts);
            out.add(new ChapterSection(i, ch.title(), ch.startSec(), text));
        }
        return out;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
