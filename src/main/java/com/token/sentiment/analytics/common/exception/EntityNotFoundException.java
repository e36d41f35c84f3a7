package com.token.sentiment.analytics.common.exception;

/**
 * Exception thrown when a token, token/network pair or network is not in the store.
 */
public class EntityNotFoundException extends BaseAnalyticsException {
    private static final String DEFAULT_ERROR_CODE = "ERR-DB-001";

    public EntityNotFoundException(String message) {
        super(message);
    }

    public EntityNotFoundException(String entityType, Long id) {
        super(String.format("%s with id %d not found", entityType, id));
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
