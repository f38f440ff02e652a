package com.example.pdfoutline.model;

import java.util.Optional;

/**
 * A span together with its heading likelihood and optional structural tag.
 */
public final class ScoredSpan {
    private final TextSpan span;
    private final int index; // position in the collector's reading order
    private final double headingScore;
    private final PatternMatch patternMatch;

    public ScoredSpan(TextSpan span, int index, double headingScore, PatternMatch patternMatch) {
        this.span = span;
        this.index = index;
        this.headingScore = headingScore;
        this.patternMatch = patternMatch;
    }

    public TextSpan getSpan() {
        return span;
    }

    public int getIndex() {
        return index;
    }

    public double getHeadingScore() {
        return headingScore;
    }

    public Optional<PatternMatch> getPatternMatch() {
        return Optional.ofNullable(patternMatch);
    }

    public String getText() {
        return span.getText();
    }

    public float getFontSize() {
        return span.getFontSize();
    }

    public int getPage() {
        return span.getPage();
    }
}
