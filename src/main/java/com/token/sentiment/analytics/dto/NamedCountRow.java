package com.token.sentiment.analytics.dto;

public record NamedCountRow(String name, Long count) {
}
