package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * One network's share of a symbol's mentions.
 *
 * @param popularityPercentage share of the mentions over all compared networks, one decimal
 */
public record NetworkTokenSentiment(String network,
                                    SentimentDistribution sentiment,
                                    double popularityPercentage,
                                    List<MentionCount> dailyMentions,
                                    List<MentionCount> topUsers) {

    public long totalMentions() {
        return sentiment.total();
    }
}
