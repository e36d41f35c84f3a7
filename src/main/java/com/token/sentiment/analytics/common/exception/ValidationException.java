package com.token.sentiment.analytics.common.exception;

/**
 * Exception for invalid query parameters (missing selector, non-positive bound, unknown interval).
 */
public class ValidationException extends BaseAnalyticsException {
    private static final String DEFAULT_ERROR_CODE = "ERR-VAL-001";

    public ValidationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
