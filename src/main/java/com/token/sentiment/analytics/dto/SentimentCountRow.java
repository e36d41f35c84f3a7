package com.token.sentiment.analytics.dto;

import com.token.sentiment.analytics.enums.Sentiment;

/**
 * One sentiment category of a grouped count: number of rows and their average confidence.
 */
public record SentimentCountRow(Sentiment sentiment, Long count, Double avgConfidence) {
}
