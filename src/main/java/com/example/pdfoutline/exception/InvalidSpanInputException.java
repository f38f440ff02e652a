package com.example.pdfoutline.exception;

/**
 * Thrown when a span document breaks the collector contract
 * (missing text or box, non-positive font size, page numbers below 1).
 */
public class InvalidSpanInputException extends RuntimeException {

    private final int spanIndex;

    public InvalidSpanInputException(int spanIndex, String message) {
        super("Span #" + spanIndex + ": " + message);
        this.spanIndex = spanIndex;
    }

    public int getSpanIndex() {
        return spanIndex;
    }
}
