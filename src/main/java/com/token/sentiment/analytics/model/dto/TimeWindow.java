package com.token.sentiment.analytics.model.dto;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Half-open interval {@code [start, end)}.
 */
public record TimeWindow(Instant start, Instant end) {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    public boolean contains(Instant ts) {
        return !ts.isBefore(start) && ts.isBefore(end);
    }

    public String period() {
        return DAY.format(start) + " to " + DAY.format(end);
    }
}
