package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"level", "text", "page"})
public final class HeadingEntry {
    private final HeadingLevel level;
    private final String text;
    private final int page;

    public HeadingEntry(HeadingLevel level, String text, int page) {
        this.level = level;
        this.text = text;
        this.page = page;
    }

    public HeadingLevel getLevel() {
        return level;
    }

    public String getText() {
        return text;
    }

    public int getPage() {
        return page;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeadingEntry)) return false;
        HeadingEntry that = (HeadingEntry) o;
        return page == that.page && level == that.level && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, text, page);
    }

    @Override
    public String toString() {
        return level + " \"" + text + "\" p" + page;
    }
}
