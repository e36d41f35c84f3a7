package com.token.sentiment.analytics.model.dto;

public record SentimentBreakdown(long count, double percentage, double avgConfidence) {

    public static final SentimentBreakdown ZERO = new SentimentBreakdown(0, 0.0, 0.0);
}
