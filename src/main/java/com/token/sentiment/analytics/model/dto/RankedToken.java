package com.token.sentiment.analytics.model.dto;

public record RankedToken(Long tokenId, String symbol, long mentions) {
}
