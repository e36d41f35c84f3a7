package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * Tokens sorted by descending momentum.
 */
public record MomentumReport(String period1, String period2, List<TokenMomentum> tokens) {
}
