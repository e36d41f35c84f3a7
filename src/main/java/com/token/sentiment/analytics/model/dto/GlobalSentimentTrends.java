package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.TimeInterval;

import java.util.List;

/**
 * Sentiment over every mention in the window, or over the most mentioned networks only.
 *
 * @param networksIncluded the network filter that was applied; empty when none was
 */
public record GlobalSentimentTrends(String period,
                                    TimeInterval interval,
                                    SentimentDistribution overall,
                                    List<TimelinePoint> timeline,
                                    List<NetworkBreakdown> networkSentiment,
                                    List<String> networksIncluded) {

    public long totalMentions() {
        return overall.total();
    }
}
