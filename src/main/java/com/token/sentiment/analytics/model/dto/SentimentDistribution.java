package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.common.SentimentMath;
import com.token.sentiment.analytics.dto.SentimentCountRow;
import com.token.sentiment.analytics.enums.Sentiment;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Sentiment counts of a set of mentions. Every category is present (zero-filled),
 * and the category counts always sum to {@link #total()}.
 */
public record SentimentDistribution(long total, double sentimentScore, Map<Sentiment, SentimentBreakdown> breakdown) {

    public static SentimentDistribution empty() {
        return fromCounts(Map.of());
    }

    public static SentimentDistribution fromRows(Collection<SentimentCountRow> rows) {
        Map<Sentiment, Long> counts = new EnumMap<>(Sentiment.class);
        Map<Sentiment, Double> confidenceSums = new EnumMap<>(Sentiment.class);
        for (SentimentCountRow r : rows) {
            if (r == null || r.sentiment() == null || r.count() == null) continue;
            long c = r.count();
            double avg = r.avgConfidence() == null ? 0.0 : r.avgConfidence();
            counts.merge(r.sentiment(), c, Long::sum);
            confidenceSums.merge(r.sentiment(), avg * c, Double::sum);
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        Map<Sentiment, SentimentBreakdown> breakdown = new EnumMap<>(Sentiment.class);
        for (Sentiment s : Sentiment.values()) {
            long c = counts.getOrDefault(s, 0L);
            double avg = c > 0 ? SentimentMath.round(confidenceSums.get(s) / c, 2) : 0.0;
            breakdown.put(s, new SentimentBreakdown(c, SentimentMath.percentage(c, total), avg));
        }
        return of(total, breakdown);
    }

    /**
     * Counts without confidence information; average confidences are 0.
     */
    public static SentimentDistribution fromCounts(Map<Sentiment, Long> counts) {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Map<Sentiment, SentimentBreakdown> breakdown = new EnumMap<>(Sentiment.class);
        for (Sentiment s : Sentiment.values()) {
            long c = counts.getOrDefault(s, 0L);
            breakdown.put(s, new SentimentBreakdown(c, SentimentMath.percentage(c, total), 0.0));
        }
        return of(total, breakdown);
    }

    private static SentimentDistribution of(long total, Map<Sentiment, SentimentBreakdown> breakdown) {
        long pos = breakdown.get(Sentiment.POSITIVE).count();
        long neg = breakdown.get(Sentiment.NEGATIVE).count();
        return new SentimentDistribution(total, SentimentMath.score(pos, neg, total),
                Collections.unmodifiableMap(breakdown));
    }

    public SentimentBreakdown get(Sentiment sentiment) {
        return breakdown.getOrDefault(sentiment, SentimentBreakdown.ZERO);
    }

    public long count(Sentiment sentiment) {
        return get(sentiment).count();
    }

    public double percentage(Sentiment sentiment) {
        return get(sentiment).percentage();
    }

    /**
     * Unrounded score, used where differences of scores are reported.
     */
    public double rawScore() {
        return SentimentMath.rawScore(count(Sentiment.POSITIVE), count(Sentiment.NEGATIVE), total);
    }
}
