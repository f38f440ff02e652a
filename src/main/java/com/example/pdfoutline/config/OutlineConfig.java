package com.example.pdfoutline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Binds the {@code outline.*} properties into the immutable objects the pipeline stages share.
 */
@Configuration
public class OutlineConfig {

    private static final Logger logger = LoggerFactory.getLogger(OutlineConfig.class);

    @Value("${outline.score.size-saturation-ratio:1.8}")
    private double sizeSaturationRatio;

    @Value("${outline.score.size-floor:0.4}")
    private double sizeFloor;

    @Value("${outline.score.size-tolerance:0.5}")
    private double sizeTolerance;

    @Value("${outline.score.size-weight:0.5}")
    private double sizeWeight;

    @Value("${outline.score.bold-weight:0.2}")
    private double boldWeight;

    @Value("${outline.score.isolation-weight:0.15}")
    private double isolationWeight;

    @Value("${outline.score.length-penalty:0.3}")
    private double lengthPenalty;

    @Value("${outline.score.pattern-boost:0.35}")
    private double patternBoost;

    @Value("${outline.score.keyword-boost:0.2}")
    private double keywordBoost;

    @Value("${outline.acceptance.margin:0.1}")
    private double acceptanceMargin;

    @Value("${outline.acceptance.min:0.3}")
    private double acceptanceMin;

    @Value("${outline.acceptance.max:0.6}")
    private double acceptanceMax;

    @Value("${outline.cluster.max-clusters:4}")
    private int maxClusters;

    @Value("${outline.cluster.max-iterations:100}")
    private int maxIterations;

    @Value("${outline.text.min-heading-length:2}")
    private int minHeadingLength;

    @Value("${outline.text.max-heading-words:20}")
    private int maxHeadingWords;

    @Value("${outline.text.max-heading-chars:150}")
    private int maxHeadingChars;

    @Value("${outline.title.margin-band-ratio:0.06}")
    private double marginBandRatio;

    @Value("${outline.filter.drop-title-duplicates:false}")
    private boolean dropTitleDuplicates;

    @Value("${outline.collector.max-pages:50}")
    private int maxPagesToAnalyze;

    @Value("${outline.batch.threads:4}")
    private int batchThreads;

    @Bean
    public OutlineSettings outlineSettings() {
        OutlineSettings settings = OutlineSettings.builder()
                .sizeSaturationRatio(sizeSaturationRatio)
                .sizeFloor(sizeFloor)
                .sizeTolerance(sizeTolerance)
                .sizeWeight(sizeWeight)
                .boldWeight(boldWeight)
                .isolationWeight(isolationWeight)
                .lengthPenalty(lengthPenalty)
                .patternBoost(patternBoost)
                .keywordBoost(keywordBoost)
                .acceptanceMargin(acceptanceMargin)
                .acceptanceMin(acceptanceMin)
                .acceptanceMax(acceptanceMax)
                .maxClusters(maxClusters)
                .maxIterations(maxIterations)
                .minHeadingLength(minHeadingLength)
                .maxHeadingWords(maxHeadingWords)
                .maxHeadingChars(maxHeadingChars)
                .marginBandRatio(marginBandRatio)
                .dropTitleDuplicates(dropTitleDuplicates)
                .maxPagesToAnalyze(maxPagesToAnalyze)
                .batchThreads(batchThreads)
                .build();
        logger.info("Outline settings: maxClusters={}, acceptance=[{}, {}] (+{} over median), maxPages={}, batchThreads={}",
                maxClusters, acceptanceMin, acceptanceMax, acceptanceMargin, maxPagesToAnalyze, batchThreads);
        return settings;
    }

    /** Pool for batch extraction; the container initializes it and drains it on shutdown. */
    @Bean(name = "outlineBatchExecutor")
    public ThreadPoolTaskExecutor outlineBatchExecutor(OutlineSettings outlineSettings) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(outlineSettings.getBatchThreads());
        executor.setMaxPoolSize(outlineSettings.getBatchThreads());
        executor.setThreadNamePrefix("outline-batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public ScriptPatternTables scriptPatternTables() {
        return ScriptPatternTables.standard();
    }
}
