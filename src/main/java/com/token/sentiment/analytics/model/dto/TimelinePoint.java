package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.Sentiment;

import java.time.Instant;

public record TimelinePoint(Instant bucketStart, String label, SentimentDistribution sentiment) {

    public long total() {
        return sentiment.total();
    }

    public long count(Sentiment s) {
        return sentiment.count(s);
    }

    public double percentage(Sentiment s) {
        return sentiment.percentage(s);
    }

    public double sentimentScore() {
        return sentiment.sentimentScore();
    }
}
