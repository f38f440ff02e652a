package com.example.pdfoutline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Font-size centroids ordered from H1 (largest) downwards. At most four, strictly decreasing.
 */
public final class LevelCluster {
    private final List<Double> centroids;

    public LevelCluster(List<Double> centroids) {
        if (centroids.size() > HeadingLevel.MAX_DEPTH) {
            throw new IllegalArgumentException("At most " + HeadingLevel.MAX_DEPTH + " levels, got " + centroids.size());
        }
        for (int i = 1; i < centroids.size(); i++) {
            if (centroids.get(i) >= centroids.get(i - 1)) {
                throw new IllegalArgumentException("Centroids must be strictly decreasing: " + centroids);
            }
        }
        this.centroids = Collections.unmodifiableList(new ArrayList<>(centroids));
    }

    public static LevelCluster empty() {
        return new LevelCluster(Collections.emptyList());
    }

    public List<Double> getCentroids() {
        return centroids;
    }

    public int size() {
        return centroids.size();
    }

    public boolean isEmpty() {
        return centroids.isEmpty();
    }

    public double centroidOf(HeadingLevel level) {
        return centroids.get(level.ordinal());
    }

    /** Level whose centroid is nearest to the given size. */
    public HeadingLevel levelFor(double fontSize) {
        int best = 0;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < centroids.size(); i++) {
            double d = Math.abs(centroids.get(i) - fontSize);
            if (d < bestDistance) {
                bestDistance = d;
                best = i;
            }
        }
        return HeadingLevel.ofDepth(best + 1);
    }

    @Override
    public String toString() {
        return "LevelCluster" + centroids;
    }
}
