package com.token.sentiment.analytics.model.dto;

public record SimilarToken(Long id, String symbol, String name, String network, double similarity) {
}
