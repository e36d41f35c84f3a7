package com.token.sentiment.analytics.model.dto;

import java.time.Instant;

/**
 * All-time mention figures of one token. First/last seen are null when it was never mentioned.
 */
public record TokenMentionStats(Long tokenId,
                                String symbol,
                                String name,
                                String network,
                                long mentionCount,
                                Instant firstSeen,
                                Instant lastSeen,
                                SentimentDistribution sentiment) {
}
