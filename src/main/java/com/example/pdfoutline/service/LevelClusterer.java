package com.example.pdfoutline.service;

import com.example.pdfoutline.config.OutlineSettings;
import com.example.pdfoutline.model.HeadingLevel;
import com.example.pdfoutline.model.LevelCluster;
import com.example.pdfoutline.model.LeveledSpan;
import com.example.pdfoutline.model.PatternMatch;
import com.example.pdfoutline.model.ScoredSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Groups accepted heading candidates by font size into at most four bands and maps them to H1..H4.
 *
 * <p>One-dimensional k-means. k is the number of distinct size bands (sizes closer than the
 * tolerance share a band), capped at the configured maximum. Initial centroids come from sorting
 * the bands and splitting them into k contiguous groups, so the result never depends on a seed.
 */
@Service
public class LevelClusterer {

    private static final Logger logger = LoggerFactory.getLogger(LevelClusterer.class);

    private final OutlineSettings settings;

    public LevelClusterer(OutlineSettings settings) {
        this.settings = settings;
    }

    public ClusteringResult cluster(List<ScoredSpan> accepted) {
        if (accepted.isEmpty()) {
            return new ClusteringResult(LevelCluster.empty(), Collections.emptyList());
        }

        double[] sizes = accepted.stream().mapToDouble(ScoredSpan::getFontSize).toArray();
        List<Double> bands = sizeBands(sizes);
        int k = Math.min(settings.getMaxClusters(), bands.size());

        double[] centroids = initialCentroids(bands, k);
        int[] assignment = lloyd(sizes, centroids);
        LevelCluster levels = toLevelCluster(sizes, assignment, centroids.length);

        List<LeveledSpan> leveled = new ArrayList<>(accepted.size());
        for (ScoredSpan span : accepted) {
            HeadingLevel sizeLevel = levels.levelFor(span.getFontSize());
            HeadingLevel level = applyNumberingTieBreak(sizeLevel, span.getPatternMatch(), levels.size());
            leveled.add(new LeveledSpan(span, sizeLevel, level));
        }

        logger.debug("{} size bands, k={}, levels {}", bands.size(), k, levels);
        return new ClusteringResult(levels, leveled);
    }

    /**
     * Numbering depth replaces the size level when the two differ by exactly one step.
     * Single-level documents keep everything at H1.
     */
    HeadingLevel applyNumberingTieBreak(HeadingLevel sizeLevel, Optional<PatternMatch> match, int levelCount) {
        if (levelCount <= 1 || match.isEmpty() || !match.get().suggestsDepth()) {
            return sizeLevel;
        }
        int depth = match.get().getDepth();
        if (depth > HeadingLevel.MAX_DEPTH) {
            return sizeLevel;
        }
        if (Math.abs(depth - sizeLevel.depth()) == 1) {
            return HeadingLevel.ofDepth(depth);
        }
        return sizeLevel;
    }

    /** Band representatives (mean size of each band), largest first. */
    List<Double> sizeBands(double[] sizes) {
        double[] sorted = sizes.clone();
        Arrays.sort(sorted);
        List<Double> bands = new ArrayList<>();
        double bandStart = sorted[sorted.length - 1];
        double sum = 0;
        int count = 0;
        for (int i = sorted.length - 1; i >= 0; i--) {
            double size = sorted[i];
            if (bandStart - size > settings.getSizeTolerance()) {
                bands.add(sum / count);
                bandStart = size;
                sum = 0;
                count = 0;
            }
            sum += size;
            count++;
        }
        bands.add(sum / count);
        return bands;
    }

    /** Splits the descending band list into k contiguous groups and averages each group. */
    private double[] initialCentroids(List<Double> bands, int k) {
        double[] centroids = new double[k];
        int n = bands.size();
        for (int g = 0; g < k; g++) {
            int from = g * n / k;
            int to = (g + 1) * n / k;
            double sum = 0;
            for (int i = from; i < to; i++) {
                sum += bands.get(i);
            }
            centroids[g] = sum / (to - from);
        }
        return centroids;
    }

    private int[] lloyd(double[] sizes, double[] centroids) {
        int[] assignment = new int[sizes.length];
        Arrays.fill(assignment, -1);

        for (int iter = 0; iter < settings.getMaxIterations(); iter++) {
            boolean changed = false;
            for (int i = 0; i < sizes.length; i++) {
                int nearest = nearest(sizes[i], centroids);
                if (nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
            double[] sums = new double[centroids.length];
            int[] counts = new int[centroids.length];
            for (int i = 0; i < sizes.length; i++) {
                sums[assignment[i]] += sizes[i];
                counts[assignment[i]]++;
            }
            for (int c = 0; c < centroids.length; c++) {
                // An emptied cluster keeps its old centroid and is dropped afterwards
                if (counts[c] > 0) {
                    centroids[c] = sums[c] / counts[c];
                }
            }
        }
        return assignment;
    }

    private static int nearest(double size, double[] centroids) {
        int best = 0;
        double bestDistance = Math.abs(size - centroids[0]);
        for (int c = 1; c < centroids.length; c++) {
            double d = Math.abs(size - centroids[c]);
            if (d < bestDistance) {
                bestDistance = d;
                best = c;
            }
        }
        return best;
    }

    private LevelCluster toLevelCluster(double[] sizes, int[] assignment, int k) {
        double[] sums = new double[k];
        int[] counts = new int[k];
        for (int i = 0; i < sizes.length; i++) {
            sums[assignment[i]] += sizes[i];
            counts[assignment[i]]++;
        }
        List<Double> centroids = new ArrayList<>();
        for (int c = 0; c < k; c++) {
            if (counts[c] > 0) {
                centroids.add(sums[c] / counts[c]);
            }
        }
        centroids.sort(Comparator.reverseOrder());

        // Strictly decreasing: identical centroids collapse into one level
        List<Double> distinct = new ArrayList<>();
        for (Double c : centroids) {
            if (distinct.isEmpty() || distinct.get(distinct.size() - 1) - c > 1e-9) {
                distinct.add(c);
            }
        }
        return new LevelCluster(distinct);
    }

    public static final class ClusteringResult {
        private final LevelCluster levels;
        private final List<LeveledSpan> leveled;

        ClusteringResult(LevelCluster levels, List<LeveledSpan> leveled) {
            this.levels = levels;
            this.leveled = Collections.unmodifiableList(leveled);
        }

        public LevelCluster getLevels() {
            return levels;
        }

        public List<LeveledSpan> getLeveled() {
            return leveled;
        }
    }
}
