package com.token.sentiment.analytics.model.dto;

public record DiscussedToken(Long tokenId, String symbol, String name, String network, long mentionCount,
                             SentimentDistribution sentiment) {

    public String displayName() {
        return new TokenKey(symbol, network).displayName();
    }
}
