package com.example.pdfoutline.model;

public enum HeadingLevel {
    H1, H2, H3, H4;

    public static final int MAX_DEPTH = 4;

    /** 1-based depth to level, clamped into H1..H4. */
    public static HeadingLevel ofDepth(int depth) {
        int clamped = Math.max(1, Math.min(MAX_DEPTH, depth));
        return values()[clamped - 1];
    }

    public int depth() {
        return ordinal() + 1;
    }
}
