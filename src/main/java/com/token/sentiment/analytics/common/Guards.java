package com.token.sentiment.analytics.common;

import com.token.sentiment.analytics.common.exception.ValidationException;

import java.util.Collection;

/**
 * Parameter checks shared by the query services. All failures are {@link ValidationException}s.
 */
public final class Guards {

    private Guards() {
    }

    public static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ValidationException(name + " must be a positive integer");
        }
    }

    public static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw new ValidationException(name + " cannot be negative");
        }
    }

    public static void requireNotEmpty(String name, Collection<?> values) {
        if (values == null || values.isEmpty()) {
            throw new ValidationException("Must provide at least one " + name);
        }
    }

    public static void requireFraction(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(name + " must be between 0 and 1");
        }
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
