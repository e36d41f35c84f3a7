package com.token.sentiment.analytics.model.dto;

import com.token.sentiment.analytics.model.entity.TokenEntity;

import java.util.Objects;

/**
 * Composite identity of a token as seen by users: symbol plus optional network.
 * A symbol alone is ambiguous when it is hosted on several networks.
 */
public record TokenKey(String symbol, String network) {

    public TokenKey {
        Objects.requireNonNull(symbol, "symbol");
    }

    public static TokenKey of(TokenEntity token) {
        return new TokenKey(token.getSymbol(), token.getNetworkName());
    }

    /**
     * "SOL (solana)", or just "SOL" without a network.
     */
    public String displayName() {
        return network == null ? symbol : symbol + " (" + network + ")";
    }
}
