package com.token.sentiment.analytics.dto;

public record TokenMentionCountRow(Long tokenId, String symbol, String name, String network, Long count) {
}
