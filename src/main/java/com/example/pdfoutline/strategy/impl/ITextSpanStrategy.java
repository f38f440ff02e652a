package com.example.pdfoutline.strategy.impl;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.strategy.SpanExtractionStrategy;
import com.example.pdfoutline.util.StyledTextExtractor;
import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary collector: iText content-stream parsing, one {@link StyledTextExtractor} per page.
 */
@Component
@Order(1)
public class ITextSpanStrategy implements SpanExtractionStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ITextSpanStrategy.class);

    private final OutlineSettings settings;

    public ITextSpanStrategy(OutlineSettings settings) {
        this.settings = settings;
    }

    @Override
    public String name() {
        return "itext";
    }

    @Override
    public SpanDocument extract(byte[] pdf) throws IOException {
        try (PdfDocument doc = new PdfDocument(new PdfReader(new ByteArrayInputStream(pdf)))) {
            int pageCount = doc.getNumberOfPages();
            int lastPage = Math.min(pageCount, settings.getMaxPagesToAnalyze());
            List<TextSpan> spans = new ArrayList<>();
            Float pageHeight = null;

            for (int p = 1; p <= lastPage; p++) {
                PdfPage page = doc.getPage(p);
                Rectangle size = page.getPageSize();
                if (p == 1) {
                    pageHeight = size.getHeight();
                }
                StyledTextExtractor extractor = new StyledTextExtractor(p, size.getTop());
                try {
                    new PdfCanvasProcessor(extractor).processPageContent(page);
                    extractor.finish();
                } catch (Exception e) {
                    logger.warn("Failed to process page {}, skipping: {}", p, e.getMessage());
                    continue;
                }
                spans.addAll(extractor.getSpans());
            }

            String title = doc.getDocumentInfo().getTitle();
            logger.debug("iText collected {} spans from {} of {} pages", spans.size(), lastPage, pageCount);
            return new SpanDocument(spans, title, pageCount, pageHeight);
        }
    }
}
