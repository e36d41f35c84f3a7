package com.token.sentiment.analytics.service.similarity;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Naive symbol matching on trimmed, lower-cased symbols: 1.0 when equal, the length ratio of
 * shorter to longer when one contains the other, and no score at all otherwise.
 * This is not an edit distance.
 */
public final class SymbolSimilarity {

    private SymbolSimilarity() {
    }

    public static OptionalDouble score(String a, String b) {
        if (a == null || b == null) return OptionalDouble.empty();
        String x = a.trim().toLowerCase(Locale.ROOT);
        String y = b.trim().toLowerCase(Locale.ROOT);
        if (x.equals(y)) return OptionalDouble.of(1.0);
        if (x.contains(y) || y.contains(x)) {
            return OptionalDouble.of((double) Math.min(x.length(), y.length()) / Math.max(x.length(), y.length()));
        }
        return OptionalDouble.empty();
    }
}
