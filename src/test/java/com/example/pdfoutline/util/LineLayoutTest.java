package com.example.pdfoutline.util;

import com.example.pdfoutline.SpanFixtures;
import com.example.pdfoutline.model.TextSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("LineLayout")
class LineLayoutTest {

    @Test
    @DisplayName("Spans at the same height share a line")
    void groupsSameLine() {
        List<TextSpan> spans = List.of(
                SpanFixtures.spanAt("Manual", 12f, 1, 200f, 100f),
                SpanFixtures.spanAt("Reference", 12f, 1, 72f, 100f),
                SpanFixtures.spanAt("Next line", 12f, 1, 72f, 120f));

        LineLayout layout = LineLayout.of(spans);

        assertThat(layout.isAloneOnLine(0)).isFalse();
        assertThat(layout.isAloneOnLine(1)).isFalse();
        assertThat(layout.isAloneOnLine(2)).isTrue();
        assertThat(layout.gapAbove(0)).isInfinite();
        assertThat(layout.gapBelow(1)).isCloseTo(5.6, within(1e-3));
    }

    @Test
    @DisplayName("Measures gaps between lines and leaves page edges unbounded")
    void measuresGaps() {
        // Boxes are 1.2 x size tall: 100..114.4 and 120..134.4
        List<TextSpan> spans = List.of(
                SpanFixtures.spanAt("First", 12f, 1, 72f, 100f),
                SpanFixtures.spanAt("Second", 12f, 1, 72f, 120f));

        LineLayout layout = LineLayout.of(spans);

        assertThat(layout.gapAbove(0)).isInfinite();
        assertThat(layout.gapBelow(0)).isCloseTo(5.6, within(1e-3));
        assertThat(layout.gapAbove(1)).isCloseTo(5.6, within(1e-3));
        assertThat(layout.gapBelow(1)).isInfinite();
        assertThat(layout.getMedianGap()).isCloseTo(5.6, within(1e-3));
    }

    @Test
    @DisplayName("Pages are laid out independently")
    void separatesPages() {
        List<TextSpan> spans = List.of(
                SpanFixtures.spanAt("Page one", 12f, 1, 72f, 100f),
                SpanFixtures.spanAt("Page two", 12f, 2, 72f, 100f));

        LineLayout layout = LineLayout.of(spans);

        assertThat(layout.gapBelow(0)).isInfinite();
        assertThat(layout.gapAbove(1)).isInfinite();
        assertThat(layout.getMedianGap()).isZero();
    }
}
