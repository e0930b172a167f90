package com.example.outline.strategy.impl;

import com.example.outline.strategy.TocEntryHeuristic;
import com.example.outline.util.TocTextUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A title is genuine if it mentions a domain keyword, or if it is shaped like a heading:
 * capitalized, not shouted, with at least two real words.
 */
public class KeywordTocEntryHeuristic implements TocEntryHeuristic {

    private static final int MIN_LENGTH = 5;
    private static final int MAX_LENGTH = 100;

    private final List<String> keywords;

    public KeywordTocEntryHeuristic(List<String> keywords) {
        List<String> lowered = new ArrayList<>();
        for (String keyword : keywords) {
            lowered.add(keyword.toLowerCase(Locale.ROOT));
        }
        this.keywords = Collections.unmodifiableList(lowered);
    }

    public List<String> getKeywords() {
        return keywords;
    }

    @Override
    public boolean looksGenuine(String title) {
        if (title == null) {
            return false;
        }
        String clean = title.trim();
        if (clean.length() < MIN_LENGTH || clean.length() > MAX_LENGTH) {
            return false;
        }
        String[] words = TocTextUtils.words(clean);
        if (words.length < 2) {
            return false;
        }

        String lower = clean.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }

        if (!Character.isUpperCase(clean.charAt(0)) || clean.equals(clean.toUpperCase(Locale.ROOT))) {
            return false;
        }
        int substantial = 0;
        for (String word : words) {
            if (word.length() > 2) {
                substantial++;
            }
        }
        return substantial >= 2;
    }
}
