package com.example.pdfoutline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Axis-aligned box in page units, top-left origin (y grows downward).
 */
public final class BoundingBox {
    private final float x0;
    private final float y0;
    private final float x1;
    private final float y1;

    @JsonCreator
    public BoundingBox(@JsonProperty("x0") float x0,
                       @JsonProperty("y0") float y0,
                       @JsonProperty("x1") float x1,
                       @JsonProperty("y1") float y1) {
        // Collectors occasionally hand us flipped corners
        this.x0 = Math.min(x0, x1);
        this.x1 = Math.max(x0, x1);
        this.y0 = Math.min(y0, y1);
        this.y1 = Math.max(y0, y1);
    }

    public float getX0() {
        return x0;
    }

    public float getY0() {
        return y0;
    }

    public float getX1() {
        return x1;
    }

    public float getY1() {
        return y1;
    }

    public float height() {
        return y1 - y0;
    }

    public float centerY() {
        return (y0 + y1) / 2f;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) o;
        return Float.compare(x0, that.x0) == 0 && Float.compare(y0, that.y0) == 0
                && Float.compare(x1, that.x1) == 0 && Float.compare(y1, that.y1) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x0, y0, x1, y1);
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f, %.1f, %.1f)", x0, y0, x1, y1);
    }
}
