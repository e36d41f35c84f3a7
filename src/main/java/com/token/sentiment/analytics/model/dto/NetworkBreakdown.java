package com.token.sentiment.analytics.model.dto;

public record NetworkBreakdown(String network, SentimentDistribution sentiment) {
}
