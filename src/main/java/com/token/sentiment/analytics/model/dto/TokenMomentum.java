package com.token.sentiment.analytics.model.dto;

/**
 * @param momentum score of the second period minus score of the first, three decimals
 */
public record TokenMomentum(TokenKey key,
                            SentimentDistribution period1,
                            SentimentDistribution period2,
                            double momentum,
                            MentionGrowth mentionGrowth) {

    public String displayName() {
        return key.displayName();
    }
}
