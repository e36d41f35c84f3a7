package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * Token x network grid. Rows follow {@code tokens}, columns follow {@code networks}; both are
 * ordered by descending mentions across the grid.
 */
public record SentimentMatrix(String period, List<String> networks, List<String> tokens, List<MatrixRow> rows) {

    public static SentimentMatrix empty(String period) {
        return new SentimentMatrix(period, List.of(), List.of(), List.of());
    }
}
