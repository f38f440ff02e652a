package com.example.pdfoutline.strategy.impl;

import com.example.pdfoutline.PdfFixtures;
import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.strategy.SpanExtractionStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Span collectors")
class SpanStrategiesTest {

    static Stream<SpanExtractionStrategy> strategies() {
        OutlineSettings settings = OutlineSettings.defaults();
        return Stream.of(new ITextSpanStrategy(settings), new PdfBoxSpanStrategy(settings));
    }

    private static Optional<TextSpan> find(SpanDocument doc, String text) {
        return doc.getSpans().stream().filter(s -> s.getText().trim().equals(text)).findFirst();
    }

    @ParameterizedTest
    @MethodSource("strategies")
    @DisplayName("Reports text, size, weight, page and a top-left origin box")
    void collectsStyledSpans(SpanExtractionStrategy strategy) throws Exception {
        byte[] pdf = PdfFixtures.headingDocument("Cluster Operations", "Getting Started", "Failure Handling");

        SpanDocument doc = strategy.extract(pdf);

        assertThat(doc.getMetadataTitle()).isEqualTo("Cluster Operations");
        assertThat(doc.getPageCount()).isEqualTo(2);
        assertThat(doc.getPageHeight()).isCloseTo(792f, within(0.5f));

        TextSpan heading = find(doc, "Getting Started").orElseThrow();
        TextSpan body = find(doc, PdfFixtures.BODY_LINE).orElseThrow();
        assertThat(heading.getFontSize()).isCloseTo(20f, within(0.5f));
        assertThat(heading.isBold()).isTrue();
        assertThat(heading.getPage()).isEqualTo(1);
        assertThat(body.getFontSize()).isCloseTo(11f, within(0.5f));
        assertThat(body.isBold()).isFalse();
        assertThat(heading.getBbox().getY0()).isLessThan(body.getBbox().getY0());
        assertThat(heading.getBbox().getY0()).isBetween(60f, 110f);

        assertThat(find(doc, "Failure Handling").orElseThrow().getPage()).isEqualTo(2);
    }

    @Test
    @DisplayName("Stops after the configured number of pages")
    void honoursPageCap() throws Exception {
        OutlineSettings onePage = OutlineSettings.builder().maxPagesToAnalyze(1).build();
        byte[] pdf = PdfFixtures.headingDocument(null, "First", "Second", "Third");

        for (SpanExtractionStrategy strategy : new SpanExtractionStrategy[]{
                new ITextSpanStrategy(onePage), new PdfBoxSpanStrategy(onePage)}) {
            SpanDocument doc = strategy.extract(pdf);
            assertThat(doc.getPageCount()).isEqualTo(3);
            assertThat(doc.getSpans()).allSatisfy(s -> assertThat(s.getPage()).isEqualTo(1));
            assertThat(doc.getMetadataTitle()).isNull();
        }
    }

    @ParameterizedTest
    @MethodSource("strategies")
    @DisplayName("Rejects bytes that are not a PDF")
    void rejectsGarbage(SpanExtractionStrategy strategy) {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> strategy.extract(garbage)).isInstanceOf(Exception.class);
    }
}
