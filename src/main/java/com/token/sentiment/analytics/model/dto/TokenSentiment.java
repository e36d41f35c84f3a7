package com.token.sentiment.analytics.model.dto;

public record TokenSentiment(String displayKey, TokenKey key, SentimentDistribution sentiment) {

    public long totalMentions() {
        return sentiment.total();
    }
}
