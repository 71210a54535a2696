package com.example.notemake_backend.service.export;

import com.example.notemake_backend.dto.pipeline.PipelineOutcome;
import com.example.notemake_backend.dto.pipeline.Summary;
import com.example.notemake_backend.dto.pipeline.TextStatistics;
import com.example.notemake_backend.dto.pipeline.TranscriptSegment;
import com.example.notemake_backend.dto.pipeline.VideoMetadata;
import com.example.notemake_backend.util.TimeFormat;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.font.PdfFont;
import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.borders.Border;
import com.itextpdf.layout.element.AreaBreak;
import com.itextpdf.layout.element.Cell;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Table;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.properties.UnitValue;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;

/**
 * PDF rendering with iText 7: title, video info table, statistics, AI summary, then the transcript on a new page.
 */
@Component
public class PdfExporter implements NoteExporter {

    private static final DeviceRgb TITLE_COLOR = new DeviceRgb(26, 26, 26);
    private static final DeviceRgb HEADING_COLOR = new DeviceRgb(51, 51, 51);
    private static final DeviceRgb LABEL_COLOR = new DeviceRgb(85, 85, 85);

    @Override
    public ExportFormat format() {
        return ExportFormat.PDF;
    }

    @Override
    public byte[] export(PipelineOutcome outcome, ExportOptions options) throws IOException {
        ExportOptions opts = options != null ? options : ExportOptions.defaults();
        VideoMetadata md = ExportSupport.metadata(outcome);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PdfDocument pdf = new PdfDocument(new PdfWriter(baos));
        Document document = new Document(pdf, PageSize.LETTER);
        try {
            PdfFont regular = PdfFontFactory.createFont(StandardFonts.HELVETICA);
            PdfFont bold = PdfFontFactory.createFont(StandardFonts.HELVETICA_BOLD);
            document.setFont(regular);
            document.setMargins(72, 72, 18, 72);

            document.add(new Paragraph(md.displayTitle())
                    .setFont(bold).setFontSize(24).setFontColor(TITLE_COLOR).setMarginBottom(30));

            Table info = table();
            row(info, "Channel:", nvl(md.channel()), bold);
            row(info, "Upload Date:", md.publishedAt() == null ? "Unknown" : md.publishedAt().toString(), bold);
            row(info, "Duration:", TimeFormat.timestamp(md.durationSec() == null ? 0 : md.durationSec()), bold);
            row(info, "Views:", String.format(Locale.US, "%,d", md.viewCount() == null ? 0L : md.viewCount()), bold);
            row(info, "URL:", md.url() != null ? md.url() : outcome.videoRef().watchUrl(), bold);
            document.add(info.setMarginBottom(20));

            TextStatistics stats = outcome.processedText() != null ? outcome.processedText().statistics() : null;
            if (opts.includeStatistics() && stats != null) {
                document.add(heading("Statistics", bold));
                Table t = table();
                row(t, "Word Count:", String.valueOf(stats.wordCount()), bold);
                row(t, "Reading Time:", stats.readingMinutesAverage() + " minutes (average)", bold);
                row(t, "Sentences:", String.valueOf(stats.sentenceCount()), bold);
                document.add(t.setMarginBottom(20));
            }

            Summary summary = outcome.summary();
            if (summary != null && summary.summary() != null && !summary.summary().isBlank()) {
                document.add(heading("Summary", bold));
                document.add(new Paragraph(summary.summary()).setFontSize(10).setMarginBottom(12));
                if (!summary.keyPoints().isEmpty()) {
                    document.add(heading("Key Points", bold));
                    for (String point : summary.keyPoints()) {
                        document.add(new Paragraph("• " + point).setFontSize(10).setMarginBottom(6));
                    }
                }
            }

            document.add(new AreaBreak());
            document.add(heading("Transcript", bold));
            for (TranscriptSegment s : outcome.transcript().segments()) {
                Paragraph p = new Paragraph().setFontSize(10).setMarginBottom(8);
                if (opts.includeTimestamps()) {
                    p.add(new Text("[" + TimeFormat.timestamp(s.startSec()) + "] ").setFont(bold));
                }
                p.add(new Text(ExportSupport.clean(s.text())));
                document.add(p);
            }
        } finally {
            document.close();
        }
        return baos.toByteArray();
    }

    private static Paragraph heading(String text, PdfFont bold) {
        return new Paragraph(text).setFont(bold).setFontSize(16).setFontColor(HEADING_COLOR).setMarginBottom(12);
    }

    private static Table table() {
        return new Table(UnitValue.createPercentArray(new float[]{1.5f, 4.5f})).useAllAvailableWidth();
    }

    private static void row(Table table, String label, String value, PdfFont bold) {
        table.addCell(new Cell().add(new Paragraph(label).setFont(bold).setFontSize(10).setFontColor(LABEL_COLOR))
                .setBorder(Border.NO_BORDER).setPaddingBottom(6));
        table.addCell(new Cell().add(new Paragraph(value).setFontSize(10))
                .setBorder(Border.NO_BORDER).setPaddingBottom(6));
    }

    private static String nvl(String s) {
        return s == null || s.isBlank() ? "Unknown" : s;
    }
}
