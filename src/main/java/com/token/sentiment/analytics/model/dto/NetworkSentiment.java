package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * @param totalTokens tokens on the network that met the per-token mention threshold
 */
public record NetworkSentiment(String network, int totalTokens, SentimentDistribution sentiment,
                               List<RankedToken> topTokens) {

    public long totalMentions() {
        return sentiment.total();
    }
}
