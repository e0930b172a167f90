package com.example.outline.model;

public class HeadingMatch {
    private final String heading;
    private final String strategyName;
    private final double confidence;

    public HeadingMatch(String heading, String strategyName, double confidence) {
        this.heading = heading;
        this.strategyName = strategyName;
        this.confidence = confidence;
    }

    public String getHeading() {
        return heading;
    }

    public String getStrategyName() {
        return strategyName;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "HeadingMatch{'" + heading + "' by " + strategyName + " conf=" + confidence + "}";
    }
}
