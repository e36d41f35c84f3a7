package com.token.sentiment.analytics.model.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Side-by-side token statistics, in the order the tokens were requested.
 */
public record TokenComparison(String period, List<TokenSentiment> tokens) {

    public Map<String, TokenSentiment> byDisplayKey() {
        Map<String, TokenSentiment> out = new LinkedHashMap<>();
        for (TokenSentiment t : tokens) out.put(t.displayKey(), t);
        return out;
    }
}
