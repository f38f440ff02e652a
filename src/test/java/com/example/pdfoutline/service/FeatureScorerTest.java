package com.example.pdfoutline.service;

import com.example.pdfoutline.SpanFixtures;
import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.config.ScriptPatternTables;
import com.example.pdfoutline.model.PatternMatch;
import com.example.pdfoutline.model.PatternTag;
import com.example.pdfoutline.model.ScoredSpan;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.util.LineLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FeatureScorer")
class FeatureScorerTest {

    private static final String BODY = "Each request is written to the journal before it is applied";

    private FeatureScorer scorer;

    @BeforeEach
    void setUp() {
        OutlineSettings settings = OutlineSettings.defaults();
        scorer = new FeatureScorer(new PatternMatcher(ScriptPatternTables.standard(), settings), settings);
    }

    @Test
    @DisplayName("Body baseline is the size carrying the most characters")
    void bodyBaselineIsCharacterWeightedMode() {
        List<TextSpan> spans = List.of(
                SpanFixtures.span("A much longer run of body text at eleven points", 11f, false, 1, 100),
                SpanFixtures.span("Short", 11f, false, 1, 120),
                SpanFixtures.span("Heading", 18f, true, 1, 60),
                SpanFixtures.span("Note", 9f, false, 1, 140));

        assertThat(scorer.bodyBaseline(spans)).isEqualTo(11.0);
    }

    @Test
    @DisplayName("Body baseline ties go to the smaller size and empty input falls back to 12pt")
    void bodyBaselineTiesAndEmpty() {
        List<TextSpan> tied = List.of(
                SpanFixtures.span("abcd", 10f, false, 1, 100),
                SpanFixtures.span("wxyz", 12f, false, 1, 120));

        assertThat(scorer.bodyBaseline(tied)).isEqualTo(10.0);
        assertThat(scorer.bodyBaseline(Collections.emptyList())).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Size factor is zero near body size and saturates at 1.8x")
    void sizeFactorShape() {
        assertThat(scorer.sizeFactor(11.0, 11.0)).isZero();
        assertThat(scorer.sizeFactor(11.5, 11.0)).isZero();
        assertThat(scorer.sizeFactor(12.0, 11.0)).isGreaterThan(0.4);
        assertThat(scorer.sizeFactor(19.8, 11.0)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.sizeFactor(40.0, 11.0)).isCloseTo(1.0, within(1e-9));
        assertThat(scorer.sizeFactor(14.0, 11.0)).isLessThan(scorer.sizeFactor(18.0, 11.0));
    }

    @Test
    @DisplayName("Long or multi-sentence text is penalized")
    void tooLong() {
        assertThat(scorer.isTooLong("Background")).isFalse();
        assertThat(scorer.isTooLong("This is one sentence. This is another one.")).isTrue();
        assertThat(scorer.isTooLong("one two three four five six seven eight nine ten eleven twelve"
                + " thirteen fourteen fifteen sixteen seventeen eighteen nineteen twenty twentyone")).isTrue();
        assertThat(scorer.isTooLong("Version 1.2 of the format")).isFalse();
        assertThat(scorer.isTooLong("1. Overview.")).isFalse();
    }

    @Test
    @DisplayName("A heading surrounded by extra whitespace is isolated, packed body lines are not")
    void isolation() {
        List<TextSpan> spans = SpanFixtures.document()
                .page(1).heading("Architecture", 16f)
                .body(BODY, 11f).body(BODY, 11f).body(BODY, 11f).body(BODY, 11f)
                .spans();
        LineLayout layout = LineLayout.of(spans);

        assertThat(scorer.isIsolated(0, layout)).isTrue();
        assertThat(scorer.isIsolated(2, layout)).isFalse();
        assertThat(scorer.isIsolated(3, layout)).isFalse();
    }

    @Test
    @DisplayName("Larger, bold, numbered headings score higher and scores stay within [0, 1]")
    void scoresAreOrderedAndBounded() {
        List<TextSpan> spans = SpanFixtures.document()
                .page(1).boldHeading("1 Architecture", 20f)
                .body(BODY, 11f).body(BODY, 11f).body(BODY, 11f)
                .heading("Storage engine", 13f)
                .body(BODY, 11f).body(BODY, 11f).body(BODY, 11f)
                .spans();

        FeatureScorer.ScoringResult result = scorer.score(spans, ScriptProfile.LATIN);

        List<ScoredSpan> all = result.getAll();
        assertThat(all).allSatisfy(s -> assertThat(s.getHeadingScore()).isBetween(0.0, 1.0));
        assertThat(all.get(0).getHeadingScore()).isEqualTo(1.0);
        assertThat(all.get(0).getHeadingScore()).isGreaterThan(all.get(4).getHeadingScore());
        assertThat(all.get(0).getPatternMatch()).isPresent();
        assertThat(result.getAccepted()).extracting(ScoredSpan::getText)
                .containsExactly("1 Architecture", "Storage engine");
    }

    @Test
    @DisplayName("Numbering in small print does not earn the pattern boost")
    void smallPrintNumberingIsNotBoosted() {
        List<TextSpan> spans = SpanFixtures.document()
                .page(1).body(BODY, 11f).body(BODY, 11f).body(BODY, 11f)
                .body("1 See the appendix", 8f)
                .spans();
        LineLayout layout = LineLayout.of(spans);
        double body = scorer.bodyBaseline(spans);

        double score = scorer.scoreSpan(spans.get(3), 3, body, layout,
                new PatternMatch(PatternTag.NUMBERED_LIST, 1, 0.35));

        assertThat(score).isLessThan(0.3);
    }

    @Test
    @DisplayName("Acceptance threshold is the median plus margin within bounds")
    void acceptanceThresholdIsClamped() {
        TextSpan s = SpanFixtures.span("x", 11f, false, 1, 0);
        List<ScoredSpan> low = List.of(new ScoredSpan(s, 0, 0.0, null), new ScoredSpan(s, 1, 0.0, null),
                new ScoredSpan(s, 2, 0.9, null));
        List<ScoredSpan> mid = List.of(new ScoredSpan(s, 0, 0.35, null), new ScoredSpan(s, 1, 0.4, null),
                new ScoredSpan(s, 2, 0.45, null));
        List<ScoredSpan> high = List.of(new ScoredSpan(s, 0, 0.9, null), new ScoredSpan(s, 1, 0.95, null),
                new ScoredSpan(s, 2, 1.0, null));

        assertThat(scorer.acceptanceThreshold(low)).isEqualTo(0.3);
        assertThat(scorer.acceptanceThreshold(mid)).isCloseTo(0.5, within(1e-9));
        assertThat(scorer.acceptanceThreshold(high)).isEqualTo(0.6);
    }
}
