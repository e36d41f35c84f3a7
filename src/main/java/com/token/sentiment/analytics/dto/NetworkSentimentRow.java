package com.token.sentiment.analytics.dto;

import com.token.sentiment.analytics.enums.Sentiment;

public record NetworkSentimentRow(String network, Sentiment sentiment, Long count) {
}
