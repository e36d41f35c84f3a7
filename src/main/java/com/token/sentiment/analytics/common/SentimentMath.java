package com.token.sentiment.analytics.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and ratio helpers. Every ratio is 0 when its denominator is 0.
 */
public final class SentimentMath {

    private SentimentMath() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0.0;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * count / total * 100, two decimals.
     */
    public static double percentage(long count, long total) {
        return percentage(count, total, 2);
    }

    public static double percentage(long count, long total, int scale) {
        if (total <= 0) return 0.0;
        return round(count * 100.0 / total, scale);
    }

    /**
     * (positive - negative) / total in [-1, 1], unrounded.
     */
    public static double rawScore(long positive, long negative, long total) {
        if (total <= 0) return 0.0;
        double s = (positive - negative) / (double) total;
        return Math.max(-1.0, Math.min(1.0, s));
    }

    public static double score(long positive, long negative, long total) {
        return round(rawScore(positive, negative, total), 2);
    }
}
