package com.example.pdfoutline.service;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.PatternMatch;
import com.example.pdfoutline.model.ScoredSpan;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.model.TextSpan;
import com.example.pdfoutline.util.HeadingTextUtils;
import com.example.pdfoutline.util.LineLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assigns every span a heading likelihood in [0, 1] and separates heading candidates from body text.
 *
 * <p>Factors, combined as a weighted sum:
 * <ul>
 *   <li>size relative to the body baseline, saturating at {@code sizeSaturationRatio};</li>
 *   <li>bold;</li>
 *   <li>isolation: alone on its line with at least median whitespace above and below;</li>
 *   <li>length: long or multi-sentence text is penalized;</li>
 *   <li>structural pattern hit (see {@link PatternMatcher}).</li>
 * </ul>
 * The acceptance threshold follows the score distribution: median score plus a margin, kept
 * within configured bounds.
 */
@Service
public class FeatureScorer {

    private static final Logger logger = LoggerFactory.getLogger(FeatureScorer.class);
    private static final float DEFAULT_BODY_SIZE = 12.0f;
    private static final double GAP_EPSILON = 0.01;

    private final PatternMatcher patternMatcher;
    private final OutlineSettings settings;

    public FeatureScorer(PatternMatcher patternMatcher, OutlineSettings settings) {
        this.patternMatcher = patternMatcher;
        this.settings = settings;
    }

    /**
     * Body text size: the font size carrying the most characters (0.1pt resolution).
     * Ties go to the smaller size.
     */
    public double bodyBaseline(List<TextSpan> spans) {
        Map<Float, Integer> freq = new HashMap<>();
        for (TextSpan span : spans) {
            String text = span.getText() == null ? "" : span.getText().trim();
            if (text.isEmpty()) continue;
            float key = Math.round(span.getFontSize() * 10f) / 10f;
            freq.merge(key, HeadingTextUtils.codePointLength(text), Integer::sum);
        }
        return freq.entrySet().stream()
                .max(Map.Entry.<Float, Integer>comparingByValue()
                        .thenComparing(Map.Entry.<Float, Integer>comparingByKey(Collections.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(DEFAULT_BODY_SIZE);
    }

    public ScoringResult score(List<TextSpan> spans, ScriptProfile profile) {
        double body = bodyBaseline(spans);
        LineLayout layout = LineLayout.of(spans);

        List<ScoredSpan> scored = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            TextSpan span = spans.get(i);
            PatternMatch match = patternMatcher.match(span.getText(), profile).orElse(null);
            double score = scoreSpan(span, i, body, layout, match);
            scored.add(new ScoredSpan(span, i, score, match));
        }

        double threshold = acceptanceThreshold(scored);
        List<ScoredSpan> accepted = scored.stream()
                .filter(s -> s.getHeadingScore() >= threshold)
                .collect(Collectors.toList());

        logger.debug("Body baseline {}pt, median gap {}, threshold {}, accepted {}/{} spans",
                body, layout.getMedianGap(), threshold, accepted.size(), scored.size());
        return new ScoringResult(body, threshold, scored, accepted);
    }

    double scoreSpan(TextSpan span, int index, double body, LineLayout layout, PatternMatch match) {
        double score = settings.getSizeWeight() * sizeFactor(span.getFontSize(), body);
        if (span.isBold()) {
            score += settings.getBoldWeight();
        }
        if (isIsolated(index, layout)) {
            score += settings.getIsolationWeight();
        }
        if (isTooLong(span.getText())) {
            score -= settings.getLengthPenalty();
        }
        // Footnote markers and list items in small print are not headings
        if (match != null && span.getFontSize() >= body - settings.getSizeTolerance()) {
            score += match.getBoost();
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    /** 0 up to body size (plus tolerance), then rises from the floor to 1 at the saturation ratio. */
    double sizeFactor(double fontSize, double body) {
        if (body <= 0 || fontSize <= body + settings.getSizeTolerance()) {
            return 0.0;
        }
        double ratio = fontSize / body;
        double progress = Math.min(1.0, (ratio - 1.0) / (settings.getSizeSaturationRatio() - 1.0));
        return settings.getSizeFloor() + (1.0 - settings.getSizeFloor()) * progress;
    }

    boolean isIsolated(int index, LineLayout layout) {
        if (!layout.isAloneOnLine(index)) {
            return false;
        }
        double median = layout.getMedianGap();
        double above = layout.gapAbove(index);
        double below = layout.gapBelow(index);
        boolean atLeastMedian = above >= median - GAP_EPSILON && below >= median - GAP_EPSILON;
        boolean someMore = above > median + GAP_EPSILON || below > median + GAP_EPSILON;
        return atLeastMedian && someMore;
    }

    boolean isTooLong(String text) {
        return HeadingTextUtils.wordCount(text) > settings.getMaxHeadingWords()
                || HeadingTextUtils.codePointLength(HeadingTextUtils.normalize(text)) > settings.getMaxHeadingChars()
                || HeadingTextUtils.sentenceCount(text) >= 2;
    }

    /** Median score plus margin, clamped to the configured bounds. */
    double acceptanceThreshold(List<ScoredSpan> scored) {
        if (scored.isEmpty()) {
            return settings.getAcceptanceMin();
        }
        List<Double> values = scored.stream()
                .map(ScoredSpan::getHeadingScore)
                .sorted()
                .collect(Collectors.toList());
        int mid = values.size() / 2;
        double median = values.size() % 2 == 0 ? (values.get(mid - 1) + values.get(mid)) / 2.0 : values.get(mid);
        double threshold = median + settings.getAcceptanceMargin();
        return Math.max(settings.getAcceptanceMin(), Math.min(settings.getAcceptanceMax(), threshold));
    }

    public static final class ScoringResult {
        private final double bodyFontSize;
        private final double threshold;
        private final List<ScoredSpan> all;
        private final List<ScoredSpan> accepted;

        ScoringResult(double bodyFontSize, double threshold, List<ScoredSpan> all, List<ScoredSpan> accepted) {
            this.bodyFontSize = bodyFontSize;
            this.threshold = threshold;
            this.all = Collections.unmodifiableList(all);
            this.accepted = Collections.unmodifiableList(accepted);
        }

        public double getBodyFontSize() {
            return bodyFontSize;
        }

        public double getThreshold() {
            return threshold;
        }

        public List<ScoredSpan> getAll() {
            return all;
        }

        public List<ScoredSpan> getAccepted() {
            return accepted;
        }
    }
}
