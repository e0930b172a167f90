package com.example.outline.strategy.impl;

import java.util.regex.Pattern;

public class AllCapsHeadingStrategy extends AbstractHeadingStrategy {

    private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z0-9\\s\\p{Punct}]{4,}$");

    public AllCapsHeadingStrategy() {
        super("all_caps");
    }

    @Override
    protected double score(String line) {
        if (!ALL_CAPS.matcher(line).matches()) {
            return 0.0;
        }
        int upper = 0;
        int alpha = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLetter(c)) {
                alpha++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        if (upper < 2) {
            return 0.0;
        }
        return (double) upper / alpha;
    }
}
