package com.example.outline.strategy.impl;

import com.example.outline.util.TocTextUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "1.2.3 Title" style headings. Deeper numbering gives higher confidence.
 */
public class NumberedHeadingStrategy extends AbstractHeadingStrategy {

    private static final Pattern NUMBERED = Pattern.compile("^(\\d+(?:\\.\\d+)*)\\s+\\S+");

    public NumberedHeadingStrategy() {
        super("numbered");
    }

    @Override
    protected double score(String line) {
        Matcher m = NUMBERED.matcher(line);
        if (!m.lookingAt()) {
            return 0.0;
        }
        int dots = TocTextUtils.countChar(m.group(1), '.');
        return Math.min(1.0, 0.6 + 0.2 * dots);
    }
}
