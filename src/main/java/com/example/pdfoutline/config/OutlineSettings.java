package com.example.pdfoutline.config;

/**
 * Process-wide thresholds and weights for the outline pipeline.
 * Built once at startup (see {@link OutlineConfig}) and handed to every stage; never mutated.
 */
public final class OutlineSettings {

    // Feature scoring
    private final double sizeSaturationRatio;
    private final double sizeFloor;
    private final double sizeTolerance;
    private final double sizeWeight;
    private final double boldWeight;
    private final double isolationWeight;
    private final double lengthPenalty;
    private final double patternBoost;
    private final double keywordBoost;

    // Acceptance threshold relative to the median score
    private final double acceptanceMargin;
    private final double acceptanceMin;
    private final double acceptanceMax;

    // Clustering
    private final int maxClusters;
    private final int maxIterations;

    // Text shape
    private final int minHeadingLength;
    private final int maxHeadingWords;
    private final int maxHeadingChars;

    // Title / filter
    private final double marginBandRatio;
    private final boolean dropTitleDuplicates;

    // Collection and batch
    private final int maxPagesToAnalyze;
    private final int batchThreads;

    private OutlineSettings(Builder b) {
        this.sizeSaturationRatio = b.sizeSaturationRatio;
        this.sizeFloor = b.sizeFloor;
        this.sizeTolerance = b.sizeTolerance;
        this.sizeWeight = b.sizeWeight;
        this.boldWeight = b.boldWeight;
        this.isolationWeight = b.isolationWeight;
        this.lengthPenalty = b.lengthPenalty;
        this.patternBoost = b.patternBoost;
        this.keywordBoost = b.keywordBoost;
        this.acceptanceMargin = b.acceptanceMargin;
        this.acceptanceMin = b.acceptanceMin;
        this.acceptanceMax = b.acceptanceMax;
        this.maxClusters = b.maxClusters;
        this.maxIterations = b.maxIterations;
        this.minHeadingLength = b.minHeadingLength;
        this.maxHeadingWords = b.maxHeadingWords;
        this.maxHeadingChars = b.maxHeadingChars;
        this.marginBandRatio = b.marginBandRatio;
        this.dropTitleDuplicates = b.dropTitleDuplicates;
        this.maxPagesToAnalyze = b.maxPagesToAnalyze;
        this.batchThreads = b.batchThreads;
    }

    public static OutlineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getSizeSaturationRatio() {
        return sizeSaturationRatio;
    }

    public double getSizeFloor() {
        return sizeFloor;
    }

    public double getSizeTolerance() {
        return sizeTolerance;
    }

    public double getSizeWeight() {
        return sizeWeight;
    }

    public double getBoldWeight() {
        return boldWeight;
    }

    public double getIsolationWeight() {
        return isolationWeight;
    }

    public double getLengthPenalty() {
        return lengthPenalty;
    }

    public double getPatternBoost() {
        return patternBoost;
    }

    public double getKeywordBoost() {
        return keywordBoost;
    }

    public double getAcceptanceMargin() {
        return acceptanceMargin;
    }

    public double getAcceptanceMin() {
        return acceptanceMin;
    }

    public double getAcceptanceMax() {
        return acceptanceMax;
    }

    public int getMaxClusters() {
        return maxClusters;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getMinHeadingLength() {
        return minHeadingLength;
    }

    public int getMaxHeadingWords() {
        return maxHeadingWords;
    }

    public int getMaxHeadingChars() {
        return maxHeadingChars;
    }

    public double getMarginBandRatio() {
        return marginBandRatio;
    }

    public boolean isDropTitleDuplicates() {
        return dropTitleDuplicates;
    }

    public int getMaxPagesToAnalyze() {
        return maxPagesToAnalyze;
    }

    public int getBatchThreads() {
        return batchThreads;
    }

    public static final class Builder {
        private double sizeSaturationRatio = 1.8;
        private double sizeFloor = 0.4;
        private double sizeTolerance = 0.5;
        private double sizeWeight = 0.5;
        private double boldWeight = 0.2;
        private double isolationWeight = 0.15;
        private double lengthPenalty = 0.3;
        private double patternBoost = 0.35;
        private double keywordBoost = 0.2;
        private double acceptanceMargin = 0.1;
        private double acceptanceMin = 0.3;
        private double acceptanceMax = 0.6;
        private int maxClusters = 4;
        private int maxIterations = 100;
        private int minHeadingLength = 2;
        private int maxHeadingWords = 20;
        private int maxHeadingChars = 150;
        private double marginBandRatio = 0.06;
        private boolean dropTitleDuplicates = false;
        private int maxPagesToAnalyze = 50;
        private int batchThreads = 4;

        private Builder() {
        }

        public Builder sizeSaturationRatio(double v) {
            this.sizeSaturationRatio = v;
            return this;
        }

        public Builder sizeFloor(double v) {
            this.sizeFloor = v;
            return this;
        }

        public Builder sizeTolerance(double v) {
            this.sizeTolerance = v;
            return this;
        }

        public Builder sizeWeight(double v) {
            this.sizeWeight = v;
            return this;
        }

        public Builder boldWeight(double v) {
            this.boldWeight = v;
            return this;
        }

        public Builder isolationWeight(double v) {
            this.isolationWeight = v;
            return this;
        }

        public Builder lengthPenalty(double v) {
            this.lengthPenalty = v;
            return this;
        }

        public Builder patternBoost(double v) {
            this.patternBoost = v;
            return this;
        }

        public Builder keywordBoost(double v) {
            this.keywordBoost = v;
            return this;
        }

        public Builder acceptanceMargin(double v) {
            this.acceptanceMargin = v;
            return this;
        }

        public Builder acceptanceMin(double v) {
            this.acceptanceMin = v;
            return this;
        }

        public Builder acceptanceMax(double v) {
            this.acceptanceMax = v;
            return this;
        }

        public Builder maxClusters(int v) {
            this.maxClusters = v;
            return this;
        }

        public Builder maxIterations(int v) {
            this.maxIterations = v;
            return this;
        }

        public Builder minHeadingLength(int v) {
            this.minHeadingLength = v;
            return this;
        }

        public Builder maxHeadingWords(int v) {
            this.maxHeadingWords = v;
            return this;
        }

        public Builder maxHeadingChars(int v) {
            this.maxHeadingChars = v;
            return this;
        }

        public Builder marginBandRatio(double v) {
            this.marginBandRatio = v;
            return this;
        }

        public Builder dropTitleDuplicates(boolean v) {
            this.dropTitleDuplicates = v;
            return this;
        }

        public Builder maxPagesToAnalyze(int v) {
            this.maxPagesToAnalyze = v;
            return this;
        }

        public Builder batchThreads(int v) {
            this.batchThreads = v;
            return this;
        }

        public OutlineSettings build() {
            if (maxClusters < 1 || maxClusters > 4) {
                throw new IllegalArgumentException("maxClusters must be within 1..4, got " + maxClusters);
            }
            if (sizeSaturationRatio <= 1.0) {
                throw new IllegalArgumentException("sizeSaturationRatio must be above 1.0, got " + sizeSaturationRatio);
            }
            if (acceptanceMin > acceptanceMax) {
                throw new IllegalArgumentException("acceptanceMin " + acceptanceMin + " exceeds acceptanceMax " + acceptanceMax);
            }
            if (batchThreads < 1) {
                throw new IllegalArgumentException("batchThreads must be positive, got " + batchThreads);
            }
            return new OutlineSettings(this);
        }
    }
}
