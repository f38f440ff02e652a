package com.example.pdfoutline.service;

import com.example.pdfoutline.SpanFixtures;
import com.example.pdfoutline.exception.PdfExtractionException;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.strategy.SpanExtractionStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpanCollectionService")
class SpanCollectionServiceTest {

    private static final byte[] PDF = {'%', 'P', 'D', 'F'};

    @Mock
    private SpanExtractionStrategy primary;

    @Mock
    private SpanExtractionStrategy fallback;

    private SpanCollectionService service;

    @BeforeEach
    void setUp() {
        lenient().when(primary.name()).thenReturn("itext");
        lenient().when(fallback.name()).thenReturn("pdfbox");
        service = new SpanCollectionService(List.of(primary, fallback));
    }

    private static SpanDocument oneSpan() {
        return SpanFixtures.document().page(1).heading("Heading", 14f).build();
    }

    @Test
    @DisplayName("Should use the first collector when it finds text")
    void shouldUsePrimary() throws IOException {
        when(primary.extract(PDF)).thenReturn(oneSpan());

        SpanCollectionService.CollectedSpans collected = service.collect(PDF);

        assertThat(collected.getCollector()).isEqualTo("itext");
        assertThat(collected.getDocument().getSpans()).hasSize(1);
        verify(fallback, never()).extract(PDF);
    }

    @Test
    @DisplayName("Should fall back when the first collector throws")
    void shouldFallBackOnFailure() throws IOException {
        when(primary.extract(PDF)).thenThrow(new IOException("broken font"));
        when(fallback.extract(PDF)).thenReturn(oneSpan());

        assertThat(service.collect(PDF).getCollector()).isEqualTo("pdfbox");
    }

    @Test
    @DisplayName("Should fall back when the first collector finds no text")
    void shouldFallBackOnEmpty() throws IOException {
        when(primary.extract(PDF)).thenReturn(SpanDocument.empty());
        when(fallback.extract(PDF)).thenReturn(oneSpan());

        assertThat(service.collect(PDF).getCollector()).isEqualTo("pdfbox");
    }

    @Test
    @DisplayName("Should return an empty document when no collector finds text")
    void shouldReturnEmptyWhenNoText() throws IOException {
        when(primary.extract(PDF)).thenReturn(SpanDocument.empty());
        when(fallback.extract(PDF)).thenThrow(new IllegalStateException("no glyphs"));

        SpanCollectionService.CollectedSpans collected = service.collect(PDF);

        assertThat(collected.getDocument().getSpans()).isEmpty();
        assertThat(collected.getCollector()).isEqualTo("itext");
    }

    @Test
    @DisplayName("Should report the PDF unreadable when every collector throws")
    void shouldThrowWhenAllFail() throws IOException {
        IOException cause = new IOException("not a PDF");
        when(primary.extract(PDF)).thenThrow(new IOException("header missing"));
        when(fallback.extract(PDF)).thenThrow(cause);

        assertThatThrownBy(() -> service.collect(PDF))
                .isInstanceOf(PdfExtractionException.class)
                .hasMessageContaining("not a PDF")
                .hasCause(cause);
    }
}
