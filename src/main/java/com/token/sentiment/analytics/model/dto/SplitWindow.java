package com.token.sentiment.analytics.model.dto;

/**
 * Two adjacent windows {@code [start, mid)} and {@code [mid, end)}.
 */
public record SplitWindow(TimeWindow first, TimeWindow second) {

    public TimeWindow whole() {
        return new TimeWindow(first.start(), second.end());
    }
}
