package com.example.notemake_backend.engine;

import com.example.notemake_backend.dto.pipeline.TranscriptResult;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.engine.Interfaces.TranscriptionEngine;
import com.example.notemake_backend.exception.PipelineException;
import com.example.notemake_backend.service.YtDlpClient;
import com.example.notemake_backend.util.ErrorKind;
import com.example.notemake_backend.util.ExtractionMode;
import com.example.notemake_backend.util.ProcessRunner;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Downloads the audio with yt-dlp, converts it to 16 kHz mono wav with ffmpeg and runs the local whisper CLI.
 */
public class WhisperLocalTranscriptionEngine implements TranscriptionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperLocalTranscriptionEngine.class);

    private final YtDlpClient ytDlp;
    private final ProcessRunner runner;
    private final String ffmpegBin;
    private final String whisperCmd;
    private final String device;
    private final Duration timeout;
    private final Path workDir;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WhisperLocalTranscriptionEngine(YtDlpClient ytDlp, ProcessRunner runner, String ffmpegBin, String whisperCmd,
                                           String device, Duration timeout, Path workDir) {
        this.ytDlp = Objects.requireNonNull(ytDlp);
        this.runner = Objects.requireNonNull(runner);
        this.ffmpegBin = ffmpegBin != null ? ffmpegBin : "ffmpeg";
        this.whisperCmd = whisperCmd != null ? whisperCmd : "whisper";
        this.device = device;
        this.timeout = timeout != null ? timeout : Duration.ofMinutes(45);
        this.workDir = (workDir != null) ? workDir : Path.of("./data/work").toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.workDir);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create work directory: " + this.workDir, e);
        }
    }

    @Override
    public String name() {
        return "whisper-local";
    }

    @Override
    public TranscriptResult transcribe(Request request) throws Exception {
        String videoId = request.ref().videoId();
        Path jobDir = workDir.resolve("asr-" + videoId + "-" + UUID.randomUUID());
        try {
            // 1) audio
            Path audio = ytDlp.downloadAudio(request.ref().watchUrl(), videoId, jobDir);

            // 2) wav/16k/mono
            Path wav = jobDir.resolve(videoId + ".wav");
            run(List.of(ffmpegBin, "-y", "-i", audio.toAbsolutePath().toString(),
                    "-ac", "1", "-ar", "16000", wav.toAbsolutePath().toString()), "ffmpeg");
            if (!Files.exists(wav)) throw new PipelineException(ErrorKind.MODEL_ERROR, "ffmpeg failed to create wav");

            // 3) whisper -> json
            Path outDir = jobDir.resolve("out");
            Files.createDirectories(outDir);
            List<String> whisper = new ArrayList<>();
            whisper.add(whisperCmd);
            whisper.add(wav.toAbsolutePath().toString());
            whisper.add("--model"); whisper.add(request.modelSize());
            whisper.add("--task"); whisper.add(request.task().id());
            if (request.langHint() != null && !request.langHint().isBlank()) {
                whisper.add("--language"); whisper.add(request.langHint());
            }
            if (device != null && !device.isBlank()) {
                whisper.add("--device"); whisper.add(device);
            }
            whisper.add("--output_format"); whisper.add("json");
            whisper.add("--output_dir"); whisper.add(outDir.toAbsolutePath().toString());
            run(whisper, "whisper");

            Path json = outDir.resolve(videoId + ".json");
            if (!Files.exists(json)) {
                throw new PipelineException(ErrorKind.MODEL_ERROR, "whisper did not produce JSON at: " + json);
            }

            // 4) parse
            JsonNode root = objectMapper.readTree(Files.readString(json));
            return parseWhisperJson(root, request.langHint());
        } finally {
            try {
                FileSystemUtils.deleteRecursively(jobDir);
            } catch (IOException e) {
                LOGGER.warn("ASR cleanup failed dir={}", jobDir, e);
            }
        }
    }

    private void run(List<String> cmd, String tool) throws InterruptedException {
        LOGGER.info("Exec: {}", String.join(" ", cmd));
        ProcessRunner.Result result;
        try {
            result = runner.run(cmd, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IOException e) {
            throw new PipelineException(ErrorKind.MODEL_ERROR, tool + " not runnable: " + e.getMessage(), e);
        }
        if (result.timedOut()) {
            throw new PipelineException(ErrorKind.TIMEOUT, tool + " timed out after " + timeout);
        }
        if (result.code() != 0) {
            String out = result.combined();
            throw new PipelineException(classify(out), tool + " failed: exit=" + result.code());
        }
    }

    static ErrorKind classify(String output) {
        if (output == null) return ErrorKind.MODEL_ERROR;
        String o = output.toLowerCase(Locale.ROOT);
        if (o.contains("out of memory") || o.contains("memoryerror") || o.contains("cannot allocate memory")
                || o.contains("no space left on device")) {
            return ErrorKind.RESOURCE_EXHAUSTED;
        }
        return ErrorKind.MODEL_ERROR;
    }

    /**
     * Reads {@code segments[].{start,end,text}} and {@code language} from whisper's JSON output.
     */
    TranscriptResult parseWhisperJson(JsonNode root, String langHint) {
        List<TranscriptSegment> segments = new ArrayList<>();
        for (JsonNode seg : root.path("segments")) {
            String text = seg.path("text").asText("").trim();
            if (text.isEmpty()) continue;
            long s = Math.round(seg.path("start").asDouble(0) * 1000.0);
            long e = Math.round(seg.path("end").asDouble(0) * 1000.0);
            segments.add(new TranscriptSegment(Math.max(0, s), Math.max(0, e), text));
        }
        if (segments.isEmpty() && root.hasNonNull("text") && !root.get("text").asText().isBlank()) {
            segments.add(new TranscriptSegment(0, 0, root.get("text").asText().trim()));
        }
        if (segments.isEmpty()) {
            throw new PipelineException(ErrorKind.MODEL_ERROR, "whisper produced an empty transcript");
        }
        String lang = root.hasNonNull("language") ? root.get("language").asText() : langHint;
        return TranscriptResult.of(segments, ExtractionMode.AUDIO, lang);
    }
}
