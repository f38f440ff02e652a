package com.example.pdfoutline.util;

import com.example.pdfoutline.model.TextSpan;
import com.itextpdf.kernel.geom.LineSegment;
import com.itextpdf.kernel.geom.Matrix;
import com.itextpdf.kernel.geom.Vector;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("StyledTextExtractor")
class StyledTextExtractorTest {

    private static final float PAGE_TOP = 792f;

    private StyledTextExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StyledTextExtractor(1, PAGE_TOP);
    }

    private static TextRenderInfo chunk(String text, float x0, float x1, float baseline) {
        TextRenderInfo info = mock(TextRenderInfo.class);
        when(info.getText()).thenReturn(text);
        when(info.getFontSize()).thenReturn(12f);
        when(info.getTextMatrix()).thenReturn(new Matrix());
        when(info.getBaseline()).thenReturn(segment(x0, x1, baseline));
        when(info.getAscentLine()).thenReturn(segment(x0, x1, baseline + 9));
        when(info.getDescentLine()).thenReturn(segment(x0, x1, baseline - 3));
        return info;
    }

    private static LineSegment segment(float x0, float x1, float y) {
        return new LineSegment(new Vector(x0, y, 1), new Vector(x1, y, 1));
    }

    @Test
    @DisplayName("A chunk drawn inside the run keeps the run's right edge")
    void overprintedChunkKeepsRightEdge() {
        extractor.eventOccurred(chunk("Overview", 72f, 150f, 700f), EventType.RENDER_TEXT);
        extractor.eventOccurred(chunk("*", 140f, 146f, 700f), EventType.RENDER_TEXT);
        extractor.eventOccurred(chunk("Next", 72f, 100f, 650f), EventType.RENDER_TEXT);
        extractor.finish();

        List<TextSpan> spans = extractor.getSpans();

        assertThat(spans).extracting(TextSpan::getText).containsExactly("Overview*", "Next");
        assertThat(spans.get(0).getBbox().getX0()).isEqualTo(72f);
        assertThat(spans.get(0).getBbox().getX1()).isEqualTo(150f);
        assertThat(spans.get(1).getBbox().getX1()).isEqualTo(100f);
    }

    @Test
    @DisplayName("Chunks with a word gap on one baseline merge with a space and a top-left box")
    void mergesWordsOnBaseline() {
        extractor.eventOccurred(chunk("Getting", 72f, 110f, 700f), EventType.RENDER_TEXT);
        extractor.eventOccurred(chunk("Started", 114f, 155f, 700f), EventType.RENDER_TEXT);
        extractor.finish();

        TextSpan span = extractor.getSpans().get(0);

        assertThat(span.getText()).isEqualTo("Getting Started");
        assertThat(span.getFontSize()).isEqualTo(12f);
        assertThat(span.getBbox().getY0()).isEqualTo(PAGE_TOP - 709f);
        assertThat(span.getBbox().getY1()).isEqualTo(PAGE_TOP - 697f);
        assertThat(span.getPage()).isEqualTo(1);
    }
}
