package com.example.pdfoutline.service;

import com.example.pdfoutline.exception.PdfExtractionException;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.strategy.SpanExtractionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the span collectors in order until one yields text.
 */
@Service
public class SpanCollectionService {

    private static final Logger logger = LoggerFactory.getLogger(SpanCollectionService.class);

    private final List<SpanExtractionStrategy> strategies;

    public SpanCollectionService(List<SpanExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * The first collector returning at least one span wins. A document without any text yields
     * an empty span document; only when every collector throws is the PDF reported unreadable.
     */
    public CollectedSpans collect(byte[] pdf) {
        Exception lastFailure = null;
        int failures = 0;
        SpanDocument emptyResult = null;
        String emptyCollector = null;

        for (SpanExtractionStrategy strategy : strategies) {
            try {
                SpanDocument doc = strategy.extract(pdf);
                if (!doc.getSpans().isEmpty()) {
                    logger.debug("Collector {} produced {} spans", strategy.name(), doc.getSpans().size());
                    return new CollectedSpans(doc, strategy.name());
                }
                logger.info("Collector {} found no text, trying next", strategy.name());
                if (emptyResult == null) {
                    emptyResult = doc;
                    emptyCollector = strategy.name();
                }
            } catch (Exception e) {
                failures++;
                lastFailure = e;
                logger.warn("Collector {} failed: {}", strategy.name(), e.getMessage());
            }
        }

        if (emptyResult != null) {
            return new CollectedSpans(emptyResult, emptyCollector);
        }
        if (failures == 0) {
            throw new PdfExtractionException("No span collector configured");
        }
        throw new PdfExtractionException("Unable to read PDF: " + lastFailure.getMessage(), lastFailure);
    }

    public static final class CollectedSpans {
        private final SpanDocument document;
        private final String collector;

        public CollectedSpans(SpanDocument document, String collector) {
            this.document = document;
            this.collector = collector;
        }

        public SpanDocument getDocument() {
            return document;
        }

        public String getCollector() {
            return collector;
        }
    }
}
