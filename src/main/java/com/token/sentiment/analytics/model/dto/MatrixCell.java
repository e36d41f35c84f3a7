package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.Sentiment;

import java.util.Map;

/**
 * One (token, network) cell. Absent when the token does not exist on the network
 * or has too few mentions there.
 */
public record MatrixCell(boolean present, long mentions, double sentimentScore, Map<Sentiment, Long> counts) {

    private static final MatrixCell ABSENT = new MatrixCell(false, 0, 0.0, Map.of());

    public static MatrixCell present(SentimentDistribution d) {
        Map<Sentiment, Long> counts = Map.of(
                Sentiment.POSITIVE, d.count(Sentiment.POSITIVE),
                Sentiment.NEGATIVE, d.count(Sentiment.NEGATIVE),
                Sentiment.NEUTRAL, d.count(Sentiment.NEUTRAL));
        return new MatrixCell(true, d.total(), d.sentimentScore(), counts);
    }

    public static MatrixCell absent() {
        return ABSENT;
    }
}
