package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A contiguous run of text sharing font attributes, as produced by a span collector.
 * Read-only input to the outline pipeline.
 */
public final class TextSpan {
    private final String text;
    private final float fontSize;
    private final boolean bold;
    private final boolean italic;
    private final BoundingBox bbox;
    private final int page; // 1-based

    @JsonCreator
    public TextSpan(@JsonProperty("text") String text,
                    @JsonProperty("fontSize") float fontSize,
                    @JsonProperty("bold") boolean bold,
                    @JsonProperty("italic") boolean italic,
                    @JsonProperty("bbox") BoundingBox bbox,
                    @JsonProperty("page") int page) {
        this.text = text;
        this.fontSize = fontSize;
        this.bold = bold;
        this.italic = italic;
        this.bbox = bbox;
        this.page = page;
    }

    public String getText() {
        return text;
    }

    public float getFontSize() {
        return fontSize;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public BoundingBox getBbox() {
        return bbox;
    }

    public int getPage() {
        return page;
    }

    @Override
    public String toString() {
        return String.format("Page %d, Size=%.2f, Bold=%b, Box=%s: \"%s\"", page, fontSize, bold, bbox, text);
    }
}
