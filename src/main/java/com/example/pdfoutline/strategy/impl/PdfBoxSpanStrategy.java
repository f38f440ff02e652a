package com.example.pdfoutline.strategy.impl;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.BoundingBox;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.strategy.SpanExtractionStrategy;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fallback collector built on PDFBox text stripping. Tolerates fonts iText cannot parse.
 */
@Component
@Order(2)
public class PdfBoxSpanStrategy implements SpanExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(PdfBoxSpanStrategy.class);

    private final OutlineSettings settings;

    public PdfBoxSpanStrategy(OutlineSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "pdfbox";
    }

    @Override
    public SpanDocument extract(byte[] pdf) throws IOException {
        try (PDDocument doc = PDDocument.load(pdf)) {
            int pageCount = doc.getNumberOfPages();
            SpanStripper stripper = new SpanStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(pageCount, settings.getMaxPagesToAnalyze()));
            stripper.getText(doc);

            List<TextSpan> spans = stripper.toSpans();
            Float pageHeight = pageCount > 0 ? doc.getPage(0).getMediaBox().getHeight() : null;
            String title = doc.getDocumentInformation().getTitle();
            logger.debug("PDFBox collected {} spans from {} pages", spans.size(), pageCount);
            return new SpanDocument(spans, title, pageCount, pageHeight);
        }
    }

    static boolean isBold(PDFont font) {
        if (font == null) {
            return false;
        }
        String name = font.getName() == null ? "" : font.getName().toLowerCase(Locale.ROOT);
        if (name.contains("bold") || name.contains("black") || name.contains("heavy")
                || name.contains("semibold") || name.contains("demi")) {
            return true;
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        return descriptor != null && (descriptor.getFontWeight() >= 600 || descriptor.isForceBold());
    }

    static boolean isItalic(PDFont font) {
        if (font == null) {
            return false;
        }
        String name = font.getName() == null ? "" : font.getName().toLowerCase(Locale.ROOT);
        if (name.contains("italic") || name.contains("oblique")) {
            return true;
        }
        PDFontDescriptor descriptor = font.getFontDescriptor();
        return descriptor != null && descriptor.isItalic();
    }

    /**
     * PDFTextStripper hands over one word at a time; words of the same style on the same
     * baseline are glued back into a span.
     */
    private static final class SpanStripper extends PDFTextStripper {
        private static final float BASELINE_TOLERANCE = 1.0f;
        private static final float RUN_BREAK_GAP_RATIO = 3.0f;

        private final List<SpanBuilder> builders = new ArrayList<>();

        SpanStripper() throws IOException {
            super();
        }

        @Override
        protected void writeString(String text, List<TextPosition> positions) throws IOException {
            if (positions.isEmpty() || text.trim().isEmpty()) {
                return;
            }
            TextPosition first = positions.get(0);
            TextPosition last = positions.get(positions.size() - 1);
            int page = getCurrentPageNo();
            float size = first.getFontSizeInPt();
            boolean bold = isBold(first.getFont());
            boolean italic = isItalic(first.getFont());

            float x0 = first.getXDirAdj();
            float x1 = last.getXDirAdj() + last.getWidthDirAdj();
            float baseline = first.getYDirAdj();
            float height = 0;
            for (TextPosition tp : positions) {
                height = Math.max(height, tp.getHeightDir());
            }
            if (height <= 0) {
                height = size;
            }

            SpanBuilder previous = builders.isEmpty() ? null : builders.get(builders.size() - 1);
            if (previous != null && previous.accepts(page, size, bold, italic, baseline, x0)) {
                previous.append(text, x1, baseline - height, baseline);
            } else {
                builders.add(new SpanBuilder(page, size, bold, italic, text, x0, x1, baseline - height, baseline));
            }
        }

        List<TextSpan> toSpans() {
            List<TextSpan> spans = new ArrayList<>(builders.size());
            for (SpanBuilder b : builders) {
                String text = b.text.toString().trim();
                if (!text.isEmpty()) {
                    spans.add(new TextSpan(text, b.size, b.bold, b.italic,
                            new BoundingBox(b.x0, b.top, b.x1, b.bottom), b.page));
                }
            }
            return spans;
        }

        private static final class SpanBuilder {
            private final int page;
            private final float size;
            private final boolean bold;
            private final boolean italic;
            private final float baseline;
            private final StringBuilder text = new StringBuilder();
            private final float x0;
            private float x1;
            private float top;
            private float bottom;

            SpanBuilder(int page, float size, boolean bold, boolean italic, String text,
                        float x0, float x1, float top, float baseline) {
                this.page = page;
                this.size = size;
                this.bold = bold;
                this.italic = italic;
                this.baseline = baseline;
                this.text.append(text);
                this.x0 = x0;
                this.x1 = x1;
                this.top = top;
                this.bottom = baseline;
            }

            boolean accepts(int page, float size, boolean bold, boolean italic, float baseline, float x0) {
                float gap = x0 - x1;
                return this.page == page
                        && Math.abs(this.size - size) < 0.01f
                        && this.bold == bold
                        && this.italic == italic
                        && Math.abs(this.baseline - baseline) <= BASELINE_TOLERANCE
                        && gap >= -size
                        && gap < RUN_BREAK_GAP_RATIO * size;
            }

            void append(String word, float wordX1, float wordTop, float wordBottom) {
                text.append(' ').append(word);
                x1 = Math.max(x1, wordX1);
                top = Math.min(top, wordTop);
                bottom = Math.max(bottom, wordBottom);
            }
        }
    }
}
