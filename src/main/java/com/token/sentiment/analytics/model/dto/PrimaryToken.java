package com.token.sentiment.analytics.model.dto;

import java.util.List;

/**
 * The subject of a correlation analysis. Holds several ids when the symbol exists on several networks.
 */
public record PrimaryToken(List<Long> tokenIds, String symbol, String network, long totalMentions) {

    public String displayName() {
        return new TokenKey(symbol, network).displayName();
    }
}
