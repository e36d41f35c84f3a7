package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.TimeInterval;

import java.util.List;

public record NetworkTimeline(String network,
                              String displayName,
                              String period,
                              TimeInterval interval,
                              SentimentDistribution overall,
                              List<MentionCount> topTokens,
                              List<TimelinePoint> timeline) {

    public long totalMentions() {
        return overall.total();
    }
}
