package com.token.sentiment.analytics.model.dto;

/**
 * A label (symbol, author, day) with the number of mentions attributed to it.
 */
public record MentionCount(String label, long mentions) {
}
