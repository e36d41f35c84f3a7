package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * Tokens by descending mention count; ties are ordered by summed likes.
 */
public record MostDiscussedTokens(String period, String network, List<DiscussedToken> tokens) {
}
