package com.token.sentiment.analytics.service.timeline;

import com.token.sentiment.analytics.dto.SentimentPointRow;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.enums.TimeInterval;
import com.token.sentiment.analytics.model.dto.MentionCount;
import com.token.sentiment.analytics.model.dto.SentimentDistribution;
import com.token.sentiment.analytics.model.dto.TimelinePoint;

import java.time.Instant;
import java.util.*;

/**
 * Groups per-mention rows by bucket start, then emits one point per non-empty bucket
 * in chronological order. Empty buckets are not back-filled.
 */
public final class TimelineBuilder {

    private TimelineBuilder() {
    }

    public static List<TimelinePoint> build(Collection<SentimentPointRow> rows, TimeInterval interval) {
        SortedMap<Instant, Map<Sentiment, Long>> buckets = new TreeMap<>();
        for (SentimentPointRow r : rows) {
            if (r.createdAt() == null || r.sentiment() == null) continue;
            buckets.computeIfAbsent(interval.truncate(r.createdAt()), k -> new EnumMap<>(Sentiment.class))
                    .merge(r.sentiment(), 1L, Long::sum);
        }
        List<TimelinePoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((start, counts) ->
                points.add(new TimelinePoint(start, interval.label(start), SentimentDistribution.fromCounts(counts))));
        return points;
    }

    /**
     * Sum of all points, used for the overall figure of a timeline.
     */
    public static SentimentDistribution total(List<TimelinePoint> points) {
        Map<Sentiment, Long> counts = new EnumMap<>(Sentiment.class);
        for (TimelinePoint p : points) {
            for (Sentiment s : Sentiment.values()) counts.merge(s, p.count(s), Long::sum);
        }
        return SentimentDistribution.fromCounts(counts);
    }

    /**
     * Mention volume per bucket, labelled, oldest first.
     */
    public static List<MentionCount> volume(Collection<Instant> times, TimeInterval interval) {
        SortedMap<Instant, Long> buckets = new TreeMap<>();
        for (Instant t : times) buckets.merge(interval.truncate(t), 1L, Long::sum);
        List<MentionCount> out = new ArrayList<>(buckets.size());
        buckets.forEach((start, n) -> out.add(new MentionCount(interval.label(start), n)));
        return out;
    }
}
