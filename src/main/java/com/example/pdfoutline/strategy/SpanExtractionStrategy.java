package com.example.pdfoutline.strategy;

import com.example.pdfoutline.model.SpanDocument;

import java.io.IOException;

/**
 * Turns raw PDF bytes into styled text spans in reading order.
 * Implementations are tried in order by {@link com.example.pdfoutline.service.SpanCollectionService};
 * throwing, or returning no spans, hands the document to the next one.
 */
public interface SpanExtractionStrategy {

    /** Short identifier reported in extraction metadata. */
    String name();

    SpanDocument extract(byte[] pdf) throws IOException;
}
