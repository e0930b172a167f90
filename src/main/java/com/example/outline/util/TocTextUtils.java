package com.example.outline.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by TOC recognition and section assembly.
 */
public final class TocTextUtils {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern DOT_LEADER = Pattern.compile("\\.{4,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FIRST_SENTENCE = Pattern.compile("^(.+?[.!?])\\s");

    private static final int TITLE_CUT_LENGTH = 80;
    private static final int DEDUP_PREFIX_LENGTH = 50;

    // 技术数据特征：数字序列、二进制串、寄存器/编码引用
    private static final List<Pattern> TECHNICAL_DATA = Arrays.asList(
            Pattern.compile("^\\d+\\s+\\d+\\s+\\d+"),
            Pattern.compile("^[01\\s]+$"),
            Pattern.compile("hex\\s+data"),
            Pattern.compile("bit\\s*=\\s*\\d"),
            Pattern.compile("k-code"),
            Pattern.compile("byte\\s+\\d"),
            Pattern.compile("^[a-z]\\d+rx"),
            Pattern.compile("preamble.*training"),
            Pattern.compile("data\\s+object\\s+\\d")
    );

    private static final Map<String, List<String>> TAG_KEYWORDS = new LinkedHashMap<>();

    static {
        TAG_KEYWORDS.put("introductory", Arrays.asList("introduction", "overview", "summary"));
        TAG_KEYWORDS.put("concluding", Arrays.asList("conclusion", "summary", "results"));
        TAG_KEYWORDS.put("supplementary", Arrays.asList("appendix", "annex", "supplement"));
        TAG_KEYWORDS.put("reference", Arrays.asList("reference", "bibliography", "citation"));
        TAG_KEYWORDS.put("visual_content", Arrays.asList("table", "figure", "diagram", "chart"));
        TAG_KEYWORDS.put("specification", Arrays.asList("specification", "requirement", "standard"));
    }

    private TocTextUtils() {
    }

    public static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(LINE_BREAK.split(text)));
    }

    /**
     * Normalizes a captured title: drops dot leaders, shortens run-on captures to their first
     * sentence (or 80 chars), strips trailing periods and collapses whitespace.
     */
    public static String cleanTitle(String raw, int maxLength) {
        if (raw == null) {
            return "";
        }
        String title = DOT_LEADER.matcher(raw.trim()).replaceAll("");

        if (title.length() > maxLength) {
            Matcher m = FIRST_SENTENCE.matcher(title);
            if (m.find() && m.group(1).length() < TITLE_CUT_LENGTH) {
                title = m.group(1);
            } else {
                title = title.substring(0, TITLE_CUT_LENGTH);
            }
        }

        title = stripTrailing(title, ". ");
        title = WHITESPACE.matcher(title).replaceAll(" ").trim();
        return title.replace(" .", ".");
    }

    /**
     * Number of dot separated components, 1 for a missing id.
     */
    public static int levelOf(String sectionId) {
        if (sectionId == null || sectionId.trim().isEmpty()) {
            return 1;
        }
        return sectionId.trim().split("\\.", -1).length;
    }

    public static String parentOf(String sectionId) {
        if (sectionId == null) {
            return null;
        }
        String id = sectionId.trim();
        int dot = id.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        return id.substring(0, dot);
    }

    public static boolean looksLikeTechnicalData(String title) {
        if (title == null) {
            return false;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (Pattern p : TECHNICAL_DATA) {
            if (p.matcher(lower).find()) {
                return true;
            }
        }
        // 短标题里夹数字，多半是表格残片
        return title.length() < 10 && containsDigit(title);
    }

    public static double digitRatio(String text) {
        if (text == null || text.isEmpty()) {
            return 0.0;
        }
        int digits = 0;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                digits++;
            }
        }
        return (double) digits / text.length();
    }

    public static int countChar(String text, char c) {
        if (text == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                count++;
            }
        }
        return count;
    }

    public static boolean containsDigit(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isDigit(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    public static boolean isAllDigits(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static String[] words(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return WHITESPACE.split(trimmed);
    }

    public static Set<String> generateTags(String title) {
        Set<String> tags = new LinkedHashSet<>();
        if (title == null) {
            return tags;
        }
        String lower = title.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> group : TAG_KEYWORDS.entrySet()) {
            for (String keyword : group.getValue()) {
                if (lower.contains(keyword)) {
                    tags.add(group.getKey());
                    break;
                }
            }
        }
        return tags;
    }

    /**
     * Two entries with the same page and the same lower-cased 50 char title prefix are duplicates.
     */
    public static String dedupKey(int page, String title) {
        String normalized = title == null ? "" : title.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > DEDUP_PREFIX_LENGTH) {
            normalized = normalized.substring(0, DEDUP_PREFIX_LENGTH);
        }
        return page + "|" + normalized;
    }

    private static String stripTrailing(String text, String chars) {
        int end = text.length();
        while (end > 0 && chars.indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        return text.substring(0, end);
    }
}
