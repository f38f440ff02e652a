package com.example.pdfoutline.model;

/**
 * A heading candidate after level assignment. {@code sizeLevel} keeps what font size alone said,
 * {@code level} is the final answer after the numbering tie-break.
 */
public final class LeveledSpan {
    private final ScoredSpan scored;
    private final HeadingLevel sizeLevel;
    private final HeadingLevel level;

    public LeveledSpan(ScoredSpan scored, HeadingLevel sizeLevel, HeadingLevel level) {
        this.scored = scored;
        this.sizeLevel = sizeLevel;
        this.level = level;
    }

    public ScoredSpan getScored() {
        return scored;
    }

    public HeadingLevel getSizeLevel() {
        return sizeLevel;
    }

    public HeadingLevel getLevel() {
        return level;
    }

    public String getText() {
        return scored.getText();
    }

    public int getPage() {
        return scored.getPage();
    }

    public int getIndex() {
        return scored.getIndex();
    }

    public float getTop() {
        return scored.getSpan().getBbox().getY0();
    }
}
