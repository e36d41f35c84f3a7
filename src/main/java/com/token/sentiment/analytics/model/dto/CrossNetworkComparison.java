package com.token.sentiment.analytics.model.dto;

import java.util.List;

public record CrossNetworkComparison(String symbol, String period, List<NetworkTokenSentiment> networks,
                                     long totalMentionsAllNetworks) {

    public int networkCount() {
        return networks.size();
    }
}
