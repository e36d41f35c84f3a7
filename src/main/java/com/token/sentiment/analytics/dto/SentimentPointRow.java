package com.token.sentiment.analytics.dto;

import com.token.sentiment.analytics.enums.Sentiment;

import java.time.Instant;

/**
 * A single labelled mention: the post's creation time and its sentiment.
 */
public record SentimentPointRow(Instant createdAt, Sentiment sentiment) {
}
