package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Service
public class ExportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExportService.class);
    private static final Pattern INVALID_FILE_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final int MAX_FILE_NAME = 100;

    private final Map<ExportFormat, NoteExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ExportService(List<NoteExporter> exporters) {
        exporters.forEach(e -> this.exporters.put(e.format(), e));
    }

    /**
     * @throws IllegalArgumentException when the outcome has no transcript or the format has no exporter.
     */
    public ExportedNote export(PipelineOutcome outcome, ExportFormat format, ExportOptions options) {
        if (outcome == null || outcome.transcript() == null) {
            throw new IllegalArgumentException("Nothing to export: no transcript");
        }
        NoteExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new IllegalArgumentException("No exporter for " + format);
        }
        try {
            byte[] bytes = exporter.export(outcome, options != null ? options : ExportOptions.defaults());
            String name = sanitizeFileName(ExportSupport.metadata(outcome).displayTitle()) + "." + format.getExtension();
            LOGGER.info("EXPORT videoId={} format={} bytes={} file={}", outcome.videoRef().videoId(), format, bytes.length, name);
            return new ExportedNote(name, format.getContentType(), bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Export failed for " + outcome.videoRef().videoId(), e);
        }
    }

    public static String sanitizeFileName(String title) {
        String name = INVALID_FILE_CHARS.matcher(title == null ? "" : title).replaceAll("")
                .trim()
                .replace(' ', '_');
        if (name.length() > MAX_FILE_NAME) {
            name = name.substring(0, MAX_FILE_NAME);
        }
        return name.isEmpty() ? "notes" : name;
    }
}
