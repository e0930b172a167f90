package com.example.outline.strategy.impl;

import com.example.outline.util.TocTextUtils;

/**
 * Title Case headings: at least two words, at least half of them starting with an uppercase
 * letter or a digit.
 */
public class MixedCapsHeadingStrategy extends AbstractHeadingStrategy {

    public MixedCapsHeadingStrategy() {
        super("mixed_caps");
    }

    @Override
    protected double score(String line) {
        String[] words = TocTextUtils.words(line);
        if (words.length < 2) {
            return 0.0;
        }
        int capitalized = 0;
        for (String word : words) {
            char first = word.charAt(0);
            if (Character.isUpperCase(first) || Character.isDigit(first)) {
                capitalized++;
            }
        }
        if (capitalized < Math.max(1, words.length / 2)) {
            return 0.0;
        }
        return (double) capitalized / words.length;
    }
}
