package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Everything a span collector knows about one document: the spans in reading order,
 * the embedded metadata title (may be null) and the page geometry.
 */
public final class SpanDocument {
    private final List<TextSpan> spans;
    private final String metadataTitle;
    private final int pageCount;
    private final Float pageHeight;

    @JsonCreator
    public SpanDocument(@JsonProperty("spans") List<TextSpan> spans,
                        @JsonProperty("metadataTitle") String metadataTitle,
                        @JsonProperty("pageCount") int pageCount,
                        @JsonProperty("pageHeight") Float pageHeight) {
        this.spans = spans == null ? Collections.emptyList() : List.copyOf(spans);
        this.metadataTitle = metadataTitle;
        this.pageCount = pageCount;
        this.pageHeight = pageHeight;
    }

    public SpanDocument(List<TextSpan> spans, String metadataTitle, int pageCount) {
        this(spans, metadataTitle, pageCount, null);
    }

    public static SpanDocument empty() {
        return new SpanDocument(Collections.emptyList(), null, 0, null);
    }

    public List<TextSpan> getSpans() {
        return spans;
    }

    public String getMetadataTitle() {
        return metadataTitle;
    }

    public int getPageCount() {
        return pageCount;
    }

    /** Page height if the collector reported one, otherwise null. */
    public Float getPageHeight() {
        return pageHeight;
    }
}
