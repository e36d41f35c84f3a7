package com.token.sentiment.analytics.model.dto;

import java.util.Map;

/**
 * @param cells keyed by network name, in column order
 */
public record MatrixRow(String token, Map<String, MatrixCell> cells) {

    public MatrixCell cell(String network) {
        return cells.getOrDefault(network, MatrixCell.absent());
    }

    public long totalMentions() {
        return cells.values().stream().mapToLong(MatrixCell::mentions).sum();
    }
}
