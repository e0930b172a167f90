package com.example.outline.strategy;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One named TOC line shape. Patterns use the named groups {@code title} and {@code page}, plus
 * {@code id} and {@code prefix} as declared by the {@link SectionIdStyle}.
 */
public class TocLinePattern {
    private final String name;
    private final Pattern pattern;
    private final SectionIdStyle idStyle;

    public TocLinePattern(String name, String regex, SectionIdStyle idStyle) {
        this.name = name;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.idStyle = idStyle;
    }

    public String getName() {
        return name;
    }

    public SectionIdStyle getIdStyle() {
        return idStyle;
    }

    public Optional<TocLineMatch> match(String line) {
        Matcher m = pattern.matcher(line);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new TocLineMatch(name, sectionId(m), m.group("title"), parsePage(m.group("page"))));
    }

    private String sectionId(Matcher m) {
        switch (idStyle) {
            case NUMERIC:
                return m.group("id");
            case PREFIXED:
                return capitalize(m.group("prefix")) + " " + m.group("id").toUpperCase(Locale.ROOT);
            default:
                return null;
        }
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }

    private static int parsePage(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    @Override
    public String toString() {
        return name + " " + pattern.pattern();
    }
}
