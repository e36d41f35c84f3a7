package com.token.sentiment.analytics.model.dto;

/**
 * Activity of one author around a token.
 * <p>
 * {@code engagementRate} is {@code (likes + 2 * reshares) / postCount} and {@code influenceScore} is
 * {@code engagementRate * postCount / 1000}. Both are ranking heuristics, not calibrated measures.
 */
public record UserActivity(String authorId,
                           String username,
                           long postCount,
                           long totalLikes,
                           long totalReshares,
                           double engagementRate,
                           double influenceScore,
                           SentimentDistribution sentiment) {
}
