package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.common.SentimentMath;

/**
 * Relative change of mention volume between two periods, in percent.
 * Growth from zero to a positive volume has no finite value and is flagged {@code unbounded}.
 */
public record MentionGrowth(double percentage, boolean unbounded) {

    public static MentionGrowth between(long before, long after) {
        if (before == 0) {
            return after > 0 ? new MentionGrowth(0.0, true) : new MentionGrowth(0.0, false);
        }
        return new MentionGrowth(SentimentMath.round((after - before) * 100.0 / before, 1), false);
    }

    @Override
    public String toString() {
        return unbounded ? "+inf%" : percentage + "%";
    }
}
