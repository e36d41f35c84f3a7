package com.token.sentiment.analytics.test.service;

import com.token.sentiment.analytics.dto.SentimentPointRow;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.enums.TimeInterval;
import com.token.sentiment.analytics.model.dto.MentionCount;
import com.token.sentiment.analytics.model.dto.TimelinePoint;
import com.token.sentiment.analytics.service.timeline.TimelineBuilder;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineBuilderTest {

    static SentimentPointRow row(String ts, Sentiment s) {
        return new SentimentPointRow(Instant.parse(ts), s);
    }

    @Test
    void unorderedRowsBecomeChronologicalPointsWithoutGaps() {
        List<SentimentPointRow> rows = List.of(
                row("2024-01-03T10:00:00Z", Sentiment.NEGATIVE),
                row("2024-01-01T09:00:00Z", Sentiment.POSITIVE),
                row("2024-01-01T23:59:59Z", Sentiment.POSITIVE),
                row("2024-01-03T00:00:00Z", Sentiment.NEUTRAL),
                row("2024-01-01T00:00:00Z", Sentiment.NEGATIVE));

        List<TimelinePoint> points = TimelineBuilder.build(rows, TimeInterval.DAY);

        assertThat(points).extracting(TimelinePoint::label).containsExactly("2024-01-01", "2024-01-03");
        TimelinePoint first = points.get(0);
        assertThat(first.total()).isEqualTo(3);
        assertThat(first.count(Sentiment.POSITIVE)).isEqualTo(2);
        assertThat(first.percentage(Sentiment.POSITIVE)).isEqualTo(66.67);
        assertThat(first.sentimentScore()).isEqualTo(0.33);
        assertThat(TimelineBuilder.total(points).total()).isEqualTo(5);
    }

    @Test
    void weeklyBucketsStartOnMonday() {
        List<TimelinePoint> points = TimelineBuilder.build(List.of(
                row("2024-01-07T12:00:00Z", Sentiment.POSITIVE),   // Sunday
                row("2024-01-08T12:00:00Z", Sentiment.POSITIVE)),  // Monday
                TimeInterval.WEEK);

        assertThat(points).extracting(TimelinePoint::label)
                .containsExactly("Week of 2024-01-01", "Week of 2024-01-08");
    }

    @Test
    void emptyInputHasNoPoints() {
        assertThat(TimelineBuilder.build(List.of(), TimeInterval.HOUR)).isEmpty();
        assertThat(TimelineBuilder.total(List.of()).total()).isZero();
    }

    @Test
    void volumePerBucket() {
        List<MentionCount> v = TimelineBuilder.volume(List.of(
                Instant.parse("2024-02-02T01:00:00Z"),
                Instant.parse("2024-02-01T05:00:00Z"),
                Instant.parse("2024-02-02T22:00:00Z")), TimeInterval.DAY);

        assertThat(v).containsExactly(new MentionCount("2024-02-01", 1), new MentionCount("2024-02-02", 2));
    }
}
