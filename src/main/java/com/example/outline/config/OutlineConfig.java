package com.example.outline.config;

import com.example.outline.service.HeadingDetector;
import com.example.outline.strategy.TocEntryHeuristic;
import com.example.outline.strategy.impl.KeywordTocEntryHeuristic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Binds {@code outline.*} properties into {@link OutlineSettings} and wires the pluggable
 * heuristics.
 */
@Configuration
public class OutlineConfig {

    private static final Logger logger = LoggerFactory.getLogger(OutlineConfig.class);

    @Value("${outline.doc-title:" + OutlineSettings.DEFAULT_DOC_TITLE + "}")
    private String docTitle;

    @Value("${outline.page.min:1}")
    private int minPage;

    @Value("${outline.page.max:9999}")
    private int maxPage;

    @Value("${outline.toc.keywords:table of contents,contents}")
    private List<String> tocKeywords;

    @Value("${outline.toc.scan-pages:60}")
    private int tocScanPages;

    @Value("${outline.heading.scan-depth:5}")
    private int headingScanDepth;

    @Value("${outline.heading.max-length:120}")
    private int maxHeadingLength;

    @Value("${outline.title.min-length:5}")
    private int minTitleLength;

    @Value("${outline.title.max-length:120}")
    private int maxTitleLength;

    @Value("${outline.fallback.min-confidence:0.6}")
    private double fallbackMinConfidence;

    @Value("${outline.validation.enabled:true}")
    private boolean validationEnabled;

    @Value("${outline.validation.sample-size:5}")
    private int validationSampleSize;

    @Value("${outline.line.max-length:500}")
    private int maxLineLength;

    // 为空时使用内置关键字表
    @Value("${outline.genuine.keywords:}")
    private List<String> genuineKeywords;

    @Value("${outline.metadata.title-pattern:}")
    private String metadataTitlePattern;

    @Bean
    public OutlineSettings outlineSettings() {
        OutlineSettings settings = OutlineSettings.builder()
                .docTitle(docTitle)
                .minPageNumber(minPage)
                .maxPageNumber(maxPage)
                .tocKeywords(tocKeywords)
                .tocScanPages(tocScanPages)
                .headingScanDepth(headingScanDepth)
                .maxHeadingLength(maxHeadingLength)
                .minTitleLength(minTitleLength)
                .maxTitleLength(maxTitleLength)
                .fallbackMinConfidence(fallbackMinConfidence)
                .validationEnabled(validationEnabled)
                .validationSampleSize(validationSampleSize)
                .maxLineLength(maxLineLength)
                .genuineKeywords(genuineKeywords)
                .metadataTitlePattern(metadataTitlePattern)
                .build();
        logger.info("Outline settings: {}", settings);
        return settings;
    }

    @Bean
    public HeadingDetector headingDetector() {
        return HeadingDetector.withDefaultStrategies();
    }

    @Bean
    public TocEntryHeuristic tocEntryHeuristic(OutlineSettings outlineSettings) {
        return new KeywordTocEntryHeuristic(outlineSettings.getGenuineKeywords());
    }
}
