package com.token.sentiment.analytics.dto;

/**
 * Mentions grouped by (symbol, network). Network is null for unaffiliated tokens.
 */
public record TokenPairCountRow(String symbol, String network, Long count) {
}
