package com.example.pdfoutline.service;

import com.example.pdfoutline.exception.InvalidSpanInputException;
import com.example.pdfoutline.model.ExtractionMetadata;
import com.example.pdfoutline.model.LeveledSpan;
import com.example.pdfoutline.model.Outline;
import com.example.pdfoutline.model.OutlineResult;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.model.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point of the outline pipeline.
 *
 * <p>identify script → title → score → cluster → filter → assemble. Every stage is a pure
 * function of its input and the shared settings, so the same span document always produces the
 * same outline.
 */
@Service
public class OutlineExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(OutlineExtractionService.class);

    private final LanguageIdentifier languageIdentifier;
    private final TitleExtractor titleExtractor;
    private final FeatureScorer featureScorer;
    private final LevelClusterer levelClusterer;
    private final CandidateFilter candidateFilter;
    private final OutlineAssembler outlineAssembler;
    private final SpanCollectionService spanCollectionService;

    public OutlineExtractionService(LanguageIdentifier languageIdentifier,
                                    TitleExtractor titleExtractor,
                                    FeatureScorer featureScorer,
                                    LevelClusterer levelClusterer,
                                    CandidateFilter candidateFilter,
                                    OutlineAssembler outlineAssembler,
                                    SpanCollectionService spanCollectionService) {
        this.languageIdentifier = languageIdentifier;
        this.titleExtractor = titleExtractor;
        this.featureScorer = featureScorer;
        this.levelClusterer = levelClusterer;
        this.candidateFilter = candidateFilter;
        this.outlineAssembler = outlineAssembler;
        this.spanCollectionService = spanCollectionService;
    }

    /**
     * Builds the outline of an already collected document.
     *
     * @throws InvalidSpanInputException if a span violates the collector contract
     */
    public OutlineResult extract(SpanDocument document) {
        long start = System.currentTimeMillis();
        validate(document);

        List<TextSpan> spans = document.getSpans();
        ScriptProfile profile = languageIdentifier.identify(spans);
        String title = titleExtractor.extract(document);

        FeatureScorer.ScoringResult scoring = featureScorer.score(spans, profile);
        LevelClusterer.ClusteringResult clustering = levelClusterer.cluster(scoring.getAccepted());
        List<LeveledSpan> headings = candidateFilter.filter(clustering.getLeveled(), profile, title);
        Outline outline = outlineAssembler.assemble(title, headings);

        long duration = System.currentTimeMillis() - start;
        int pages = document.getPageCount() > 0
                ? document.getPageCount()
                : (int) spans.stream().mapToInt(TextSpan::getPage).distinct().count();
        ExtractionMetadata metadata = new ExtractionMetadata(profile, scoring.getBodyFontSize(),
                scoring.getThreshold(), clustering.getLevels().getCentroids(), spans.size(),
                outline.getEntries().size(), pages, duration, null);

        logger.info("Outline built: {} spans, script {}, body {}pt, {} candidates, {} headings, {} levels in {} ms",
                spans.size(), profile, scoring.getBodyFontSize(), scoring.getAccepted().size(),
                outline.getEntries().size(), clustering.getLevels().size(), duration);
        return new OutlineResult(outline, metadata);
    }

    /** Collects spans from the PDF, then builds its outline. */
    public OutlineResult extractFromPdf(byte[] pdf) {
        long start = System.currentTimeMillis();
        SpanCollectionService.CollectedSpans collected = spanCollectionService.collect(pdf);
        OutlineResult result = extract(collected.getDocument());
        logger.info("PDF of {} bytes processed with {} in {} ms",
                pdf.length, collected.getCollector(), System.currentTimeMillis() - start);
        return new OutlineResult(result.getOutline(), result.getMetadata().withCollector(collected.getCollector()));
    }

    void validate(SpanDocument document) {
        if (document == null) {
            throw new InvalidSpanInputException(-1, "document is missing");
        }
        List<TextSpan> spans = document.getSpans();
        for (int i = 0; i < spans.size(); i++) {
            TextSpan span = spans.get(i);
            if (span == null) {
                throw new InvalidSpanInputException(i, "span is missing");
            }
            if (span.getText() == null) {
                throw new InvalidSpanInputException(i, "text is missing");
            }
            if (span.getBbox() == null) {
                throw new InvalidSpanInputException(i, "bounding box is missing");
            }
            float size = span.getFontSize();
            if (Float.isNaN(size) || Float.isInfinite(size) || size <= 0) {
                throw new InvalidSpanInputException(i, "font size must be a positive number, got " + size);
            }
            if (span.getPage() < 1) {
                throw new InvalidSpanInputException(i, "page must be 1 or greater, got " + span.getPage());
            }
        }
    }
}
