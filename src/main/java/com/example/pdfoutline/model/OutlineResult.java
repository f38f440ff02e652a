package com.example.pdfoutline.model;

public final class OutlineResult {
    private final Outline outline;
    private final ExtractionMetadata metadata;

    public OutlineResult(Outline outline, ExtractionMetadata metadata) {
        this.outline = outline;
        this.metadata = metadata;
    }

    public Outline getOutline() {
        return outline;
    }

    public ExtractionMetadata getMetadata() {
        return metadata;
    }
}
