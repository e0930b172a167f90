package com.example.outline.config;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Every threshold the outline extraction consults, in one immutable object.
 *
 * Defaults match what works on large numbered technical specifications; Spring wiring in
 * {@link OutlineConfig} overrides them from {@code outline.*} properties.
 */
public final class OutlineSettings {
    public static final String DEFAULT_DOC_TITLE = "Technical Specification Document";
    public static final int DEFAULT_MAX_PAGE = 9999;

    private static final List<String> DEFAULT_TOC_KEYWORDS = Arrays.asList("table of contents", "contents");
    private static final List<String> DEFAULT_GENUINE_KEYWORDS = Arrays.asList(
            "introduction", "overview", "specification", "requirements", "protocol", "interface",
            "power", "delivery", "usb", "connector", "cable", "message", "communication",
            "appendix", "annex", "reference", "glossary", "index", "chapter", "section",
            "figure", "table", "example");

    private final String docTitle;
    private final int minPageNumber;
    private final int maxPageNumber;
    private final List<String> tocKeywords;
    private final int tocScanPages;
    private final int headingScanDepth;
    private final int maxHeadingLength;
    private final int minTitleLength;
    private final int maxTitleLength;
    private final int maxTitlePeriods;
    private final double maxDigitRatio;
    private final double fallbackMinConfidence;
    private final int fallbackMinTitleLength;
    private final int maxLineLength;
    private final boolean validationEnabled;
    private final int validationSampleSize;
    private final List<String> genuineKeywords;
    private final String metadataTitlePattern;

    private OutlineSettings(Builder builder) {
        this.docTitle = builder.docTitle != null && !builder.docTitle.trim().isEmpty()
                ? builder.docTitle.trim() : DEFAULT_DOC_TITLE;
        this.minPageNumber = Math.max(1, builder.minPageNumber);
        this.maxPageNumber = Math.max(this.minPageNumber, builder.maxPageNumber);
        this.tocKeywords = normalize(builder.tocKeywords, DEFAULT_TOC_KEYWORDS);
        this.tocScanPages = builder.tocScanPages;
        this.headingScanDepth = Math.max(1, builder.headingScanDepth);
        this.maxHeadingLength = builder.maxHeadingLength;
        this.minTitleLength = builder.minTitleLength;
        this.maxTitleLength = Math.max(builder.minTitleLength, builder.maxTitleLength);
        this.maxTitlePeriods = builder.maxTitlePeriods;
        this.maxDigitRatio = builder.maxDigitRatio;
        this.fallbackMinConfidence = builder.fallbackMinConfidence;
        this.fallbackMinTitleLength = builder.fallbackMinTitleLength;
        this.maxLineLength = builder.maxLineLength;
        this.validationEnabled = builder.validationEnabled;
        this.validationSampleSize = Math.max(1, builder.validationSampleSize);
        this.genuineKeywords = normalize(builder.genuineKeywords, DEFAULT_GENUINE_KEYWORDS);
        this.metadataTitlePattern = builder.metadataTitlePattern;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OutlineSettings defaults() {
        return builder().build();
    }

    private static List<String> normalize(List<String> values, List<String> fallback) {
        if (values == null || values.isEmpty()) {
            return Collections.unmodifiableList(fallback);
        }
        List<String> cleaned = values.stream()
                .filter(v -> v != null && !v.trim().isEmpty())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        return cleaned.isEmpty()
                ? Collections.unmodifiableList(fallback)
                : Collections.unmodifiableList(cleaned);
    }

    public String getDocTitle() {
        return docTitle;
    }

    public int getMinPageNumber() {
        return minPageNumber;
    }

    /**
     * Upper bound for any page number read from a TOC line. Four digits is the widest page
     * token the patterns capture.
     */
    public int getMaxPageNumber() {
        return maxPageNumber;
    }

    public List<String> getTocKeywords() {
        return tocKeywords;
    }

    /**
     * Number of leading PDF pages read when only the TOC is previewed.
     */
    public int getTocScanPages() {
        return tocScanPages;
    }

    public int getHeadingScanDepth() {
        return headingScanDepth;
    }

    public int getMaxHeadingLength() {
        return maxHeadingLength;
    }

    public int getMinTitleLength() {
        return minTitleLength;
    }

    public int getMaxTitleLength() {
        return maxTitleLength;
    }

    public int getMaxTitlePeriods() {
        return maxTitlePeriods;
    }

    public double getMaxDigitRatio() {
        return maxDigitRatio;
    }

    public double getFallbackMinConfidence() {
        return fallbackMinConfidence;
    }

    public int getFallbackMinTitleLength() {
        return fallbackMinTitleLength;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public boolean isValidationEnabled() {
        return validationEnabled;
    }

    public int getValidationSampleSize() {
        return validationSampleSize;
    }

    public List<String> getGenuineKeywords() {
        return genuineKeywords;
    }

    public String getMetadataTitlePattern() {
        return metadataTitlePattern;
    }

    public boolean isPlausiblePage(int page) {
        return page >= minPageNumber && page <= maxPageNumber;
    }

    @Override
    public String toString() {
        return "OutlineSettings{"
                + "docTitle='" + docTitle + '\''
                + ", pages=[" + minPageNumber + ", " + maxPageNumber + "]"
                + ", tocKeywords=" + tocKeywords
                + ", headingScanDepth=" + headingScanDepth
                + ", title=[" + minTitleLength + ", " + maxTitleLength + "]"
                + ", fallbackMinConfidence=" + fallbackMinConfidence
                + ", validationEnabled=" + validationEnabled
                + '}';
    }

    public static final class Builder {
        private String docTitle = DEFAULT_DOC_TITLE;
        private int minPageNumber = 1;
        private int maxPageNumber = DEFAULT_MAX_PAGE;
        private List<String> tocKeywords = DEFAULT_TOC_KEYWORDS;
        private int tocScanPages = 60;
        private int headingScanDepth = 5;
        private int maxHeadingLength = 120;
        private int minTitleLength = 5;
        private int maxTitleLength = 120;
        private int maxTitlePeriods = 15;
        private double maxDigitRatio = 0.4;
        private double fallbackMinConfidence = 0.6;
        private int fallbackMinTitleLength = 8;
        private int maxLineLength = 500;
        private boolean validationEnabled = true;
        private int validationSampleSize = 5;
        private List<String> genuineKeywords = DEFAULT_GENUINE_KEYWORDS;
        private String metadataTitlePattern;

        private Builder() {
        }

        public Builder docTitle(String docTitle) {
            this.docTitle = docTitle;
            return this;
        }

        public Builder minPageNumber(int minPageNumber) {
            this.minPageNumber = minPageNumber;
            return this;
        }

        public Builder maxPageNumber(int maxPageNumber) {
            this.maxPageNumber = maxPageNumber;
            return this;
        }

        public Builder tocKeywords(List<String> tocKeywords) {
            this.tocKeywords = tocKeywords;
            return this;
        }

        public Builder tocScanPages(int tocScanPages) {
            this.tocScanPages = tocScanPages;
            return this;
        }

        public Builder headingScanDepth(int headingScanDepth) {
            this.headingScanDepth = headingScanDepth;
            return this;
        }

        public Builder maxHeadingLength(int maxHeadingLength) {
            this.maxHeadingLength = maxHeadingLength;
            return this;
        }

        public Builder minTitleLength(int minTitleLength) {
            this.minTitleLength = minTitleLength;
            return this;
        }

        public Builder maxTitleLength(int maxTitleLength) {
            this.maxTitleLength = maxTitleLength;
            return this;
        }

        public Builder maxTitlePeriods(int maxTitlePeriods) {
            this.maxTitlePeriods = maxTitlePeriods;
            return this;
        }

        public Builder maxDigitRatio(double maxDigitRatio) {
            this.maxDigitRatio = maxDigitRatio;
            return this;
        }

        public Builder fallbackMinConfidence(double fallbackMinConfidence) {
            this.fallbackMinConfidence = fallbackMinConfidence;
            return this;
        }

        public Builder fallbackMinTitleLength(int fallbackMinTitleLength) {
            this.fallbackMinTitleLength = fallbackMinTitleLength;
            return this;
        }

        public Builder maxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder validationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
            return this;
        }

        public Builder validationSampleSize(int validationSampleSize) {
            this.validationSampleSize = validationSampleSize;
            return this;
        }

        public Builder genuineKeywords(List<String> genuineKeywords) {
            this.genuineKeywords = genuineKeywords;
            return this;
        }

        public Builder metadataTitlePattern(String metadataTitlePattern) {
            this.metadataTitlePattern = metadataTitlePattern;
            return this;
        }

        public OutlineSettings build() {
            return new OutlineSettings(this);
        }
    }
}
