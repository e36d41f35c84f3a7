package com.token.sentiment.analytics.enums;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
