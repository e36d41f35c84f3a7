package com.token.sentiment.analytics.common.exception;

import lombok.Getter;

/**
 * Base exception class for all analytics exceptions.
 * Provides a standard way to include error codes with exceptions.
 */
@Getter
public abstract class BaseAnalyticsException extends RuntimeException {

    private final String errorCode;

    public BaseAnalyticsException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    /**
     * Each subclass must provide a default error code.
     */
    protected abstract String getDefaultErrorCode();
}
