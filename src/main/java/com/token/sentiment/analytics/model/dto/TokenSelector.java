package com.token.sentiment.analytics.model.dto;

/**
 * Identifies the token(s) an analytics call is about. A symbol selects every token carrying it
 * (optionally narrowed to one network); an id selects exactly one token. When both are present
 * the symbol wins.
 */
public record TokenSelector(String symbol, Long tokenId, String network) {

    public static TokenSelector bySymbol(String symbol) {
        return new TokenSelector(symbol, null, null);
    }

    public static TokenSelector bySymbol(String symbol, String network) {
        return new TokenSelector(symbol, null, network);
    }

    public static TokenSelector byId(Long tokenId) {
        return new TokenSelector(null, tokenId, null);
    }

    public static TokenSelector byId(Long tokenId, String network) {
        return new TokenSelector(null, tokenId, network);
    }
}
