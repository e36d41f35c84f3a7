package com.token.sentiment.analytics.enums;

import com.token.sentiment.analytics.common.exception.ValidationException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.Locale;

/**
 * Timeline bucket widths. Buckets are aligned in UTC; weeks start on Monday.
 */
public enum TimeInterval {
    HOUR("yyyy-MM-dd HH:00"),
    DAY("yyyy-MM-dd"),
    WEEK("'Week of 'yyyy-MM-dd"),
    MONTH("yyyy-MM");

    private final DateTimeFormatter labelFormat;

    TimeInterval(String pattern) {
        this.labelFormat = DateTimeFormatter.ofPattern(pattern, Locale.ROOT).withZone(ZoneOffset.UTC);
    }

    public static TimeInterval parse(String value) {
        if (value != null) {
            String v = value.trim().toUpperCase(Locale.ROOT);
            for (TimeInterval i : values()) {
                if (i.name().equals(v)) return i;
            }
        }
        throw new ValidationException("Invalid interval '" + value + "'. Must be one of: "
                + Arrays.toString(Arrays.stream(values()).map(i -> i.name().toLowerCase(Locale.ROOT)).toArray()));
    }

    /**
     * Start of the bucket containing {@code ts}.
     */
    public Instant truncate(Instant ts) {
        switch (this) {
            case HOUR:
                return ts.truncatedTo(ChronoUnit.HOURS);
            case DAY:
                return ts.truncatedTo(ChronoUnit.DAYS);
            case WEEK: {
                LocalDate d = LocalDate.ofInstant(ts, ZoneOffset.UTC)
                        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                return d.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            case MONTH: {
                LocalDate d = LocalDate.ofInstant(ts, ZoneOffset.UTC).withDayOfMonth(1);
                return d.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            default:
                throw new IllegalStateException("Unhandled interval " + this);
        }
    }

    public String label(Instant bucketStart) {
        return labelFormat.format(bucketStart);
    }
}
