package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * Networks sorted by descending total mentions.
 */
public record NetworkComparison(String period, List<NetworkSentiment> networks) {
}
