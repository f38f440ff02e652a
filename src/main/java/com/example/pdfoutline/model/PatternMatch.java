package com.example.pdfoutline.model;

/**
 * Result of a structural pattern hit.
 * {@code depth} is the nesting depth suggested by the marker, 0 when the marker says nothing about it.
 */
public final class PatternMatch {
    private final PatternTag tag;
    private final int depth;
    private final double boost;

    public PatternMatch(PatternTag tag, int depth, double boost) {
        this.tag = tag;
        this.depth = depth;
        this.boost = boost;
    }

    public PatternTag getTag() {
        return tag;
    }

    public int getDepth() {
        return depth;
    }

    public double getBoost() {
        return boost;
    }

    public boolean suggestsDepth() {
        return depth > 0;
    }

    @Override
    public String toString() {
        return tag + "(depth=" + depth + ")";
    }
}
