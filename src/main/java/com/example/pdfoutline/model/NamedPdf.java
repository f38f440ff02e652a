package com.example.pdfoutline.model;

/**
 * PDF bytes with a display name, the unit of work for batch extraction.
 */
public final class NamedPdf {
    private final String name;
    private final byte[] content;

    public NamedPdf(String name, byte[] content) {
        this.name = name;
        this.content = content;
    }

    public String getName() {
        return name;
    }

    public byte[] getContent() {
        return content;
    }
}
