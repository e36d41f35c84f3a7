package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.enums.TimeInterval;

import java.util.List;

/**
 * Chronologically ordered points, one per non-empty bucket.
 */
public record SentimentTimeline(String token, String network, String period, TimeInterval interval,
                                List<TimelinePoint> points) {
}
