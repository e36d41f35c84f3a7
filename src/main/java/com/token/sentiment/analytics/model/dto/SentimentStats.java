package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.Sentiment;

/**
 * Sentiment statistics of one token selector over a window.
 */
public record SentimentStats(String token, String network, String period, SentimentDistribution distribution) {

    public long totalMentions() {
        return distribution.total();
    }

    public double sentimentScore() {
        return distribution.sentimentScore();
    }

    public SentimentBreakdown breakdown(Sentiment sentiment) {
        return distribution.get(sentiment);
    }
}
