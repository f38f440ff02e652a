package com.example.pdfoutline.model;

import java.util.List;

/**
 * Diagnostics gathered while building an outline. Not part of the serialized outline itself.
 */
public final class ExtractionMetadata {
    private final ScriptProfile language;
    private final double bodyFontSize;
    private final double acceptanceThreshold;
    private final List<Double> levelCentroids;
    private final int spansAnalyzed;
    private final int headingsFound;
    private final int pagesProcessed;
    private final long processingTimeMs;
    private final String collector;

    public ExtractionMetadata(ScriptProfile language, double bodyFontSize, double acceptanceThreshold,
                              List<Double> levelCentroids, int spansAnalyzed, int headingsFound,
                              int pagesProcessed, long processingTimeMs, String collector) {
        this.language = language;
        this.bodyFontSize = bodyFontSize;
        this.acceptanceThreshold = acceptanceThreshold;
        this.levelCentroids = List.copyOf(levelCentroids);
        this.spansAnalyzed = spansAnalyzed;
        this.headingsFound = headingsFound;
        this.pagesProcessed = pagesProcessed;
        this.processingTimeMs = processingTimeMs;
        this.collector = collector;
    }

    /** Same figures, tagged with the collector that produced the spans. */
    public ExtractionMetadata withCollector(String collectorName) {
        return new ExtractionMetadata(language, bodyFontSize, acceptanceThreshold, levelCentroids,
                spansAnalyzed, headingsFound, pagesProcessed, processingTimeMs, collectorName);
    }

    public ScriptProfile getLanguage() {
        return language;
    }

    public double getBodyFontSize() {
        return bodyFontSize;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public List<Double> getLevelCentroids() {
        return levelCentroids;
    }

    public int getSpansAnalyzed() {
        return spansAnalyzed;
    }

    public int getHeadingsFound() {
        return headingsFound;
    }

    public int getPagesProcessed() {
        return pagesProcessed;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public String getCollector() {
        return collector;
    }
}
