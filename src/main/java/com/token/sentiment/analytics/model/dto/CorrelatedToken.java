package com.token.sentiment.analytics.model.dto;

/**
 * @param coMentionCount        distinct posts mentioning both this token and the primary token
 * @param correlationPercentage coMentionCount over the primary token's mentions, in percent
 * @param combinedSentiment     sentiment of the posts mentioning both
 */
public record CorrelatedToken(Long tokenId,
                              String symbol,
                              String name,
                              String network,
                              long coMentionCount,
                              double correlationPercentage,
                              SentimentDistribution combinedSentiment) {

    public String displayName() {
        return new TokenKey(symbol, network).displayName();
    }
}
