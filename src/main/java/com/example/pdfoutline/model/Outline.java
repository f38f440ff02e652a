package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Final result for one document: serialized as {@code {"title": ..., "outline": [...]}}.
 */
@JsonPropertyOrder({"title", "outline"})
public final class Outline {
    private final String title;
    private final List<HeadingEntry> entries;

    public Outline(String title, List<HeadingEntry> entries) {
        this.title = title == null ? "" : title;
        this.entries = entries == null ? Collections.emptyList() : List.copyOf(entries);
    }

    public static Outline empty() {
        return new Outline("", Collections.emptyList());
    }

    public String getTitle() {
        return title;
    }

    @JsonProperty("outline")
    public List<HeadingEntry> getEntries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outline)) return false;
        Outline outline = (Outline) o;
        return title.equals(outline.title) && entries.equals(outline.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, entries);
    }
}
