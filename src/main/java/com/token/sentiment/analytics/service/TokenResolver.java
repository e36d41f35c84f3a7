package com.token.sentiment.analytics.service;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.exception.EntityNotFoundException;
import com.token.sentiment.analytics.common.exception.ValidationException;
import com.token.sentiment.analytics.model.dto.TokenKey;
import com.token.sentiment.analytics.model.dto.TokenSelector;
import com.token.sentiment.analytics.model.entity.NetworkEntity;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.NetworkRepository;
import com.token.sentiment.analytics.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Resolves user-facing token and network references to stored entities.
 * A symbol without a network resolves to every token carrying it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TokenResolver {

    private final TokenRepository tokenRepository;
    private final NetworkRepository networkRepository;

    public List<TokenEntity> resolve(TokenSelector selector) {
        if (selector == null || (!Guards.hasText(selector.symbol()) && selector.tokenId() == null)) {
            throw new ValidationException("Must provide either token_symbol or token_id");
        }
        String network = Guards.hasText(selector.network()) ? selector.network() : null;

        if (Guards.hasText(selector.symbol())) {
            return resolveSymbol(selector.symbol(), network);
        }

        TokenEntity token = tokenRepository.findById(selector.tokenId())
                .orElseThrow(() -> new EntityNotFoundException("Token", selector.tokenId()));
        if (network != null && !network.equals(token.getNetworkName())) {
            throw new EntityNotFoundException("Token with ID '" + selector.tokenId()
                    + "' on network '" + network + "' not found");
        }
        return List.of(token);
    }

    public List<TokenEntity> resolveSymbol(String symbol, String network) {
        List<TokenEntity> tokens = network == null
                ? tokenRepository.findBySymbol(symbol)
                : tokenRepository.findBySymbolAndNetwork_Name(symbol, network);
        if (tokens.isEmpty()) {
            String msg = "Token with symbol '" + symbol + "'"
                    + (network == null ? "" : " on network '" + network + "'") + " not found";
            log.warn("resolveSymbol: {}", msg);
            throw new EntityNotFoundException(msg);
        }
        return tokens;
    }

    /**
     * Exact (symbol, network) lookup; a null network matches only tokens without one.
     */
    public List<TokenEntity> resolveKey(TokenKey key) {
        return key.network() == null
                ? tokenRepository.findBySymbolAndNetworkIsNull(key.symbol())
                : tokenRepository.findBySymbolAndNetwork_Name(key.symbol(), key.network());
    }

    public NetworkEntity requireNetwork(String name) {
        return networkRepository.findByName(name).orElseThrow(() -> {
            log.warn("requireNetwork: unknown network '{}'", name);
            return new EntityNotFoundException("Blockchain network '" + name + "' not found");
        });
    }

    /**
     * All names must exist; the error lists every missing one.
     */
    public void requireNetworks(Collection<String> names) {
        Set<String> existing = new HashSet<>();
        for (NetworkEntity n : networkRepository.findByNameIn(names)) existing.add(n.getName());
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!existing.contains(name)) missing.add(name);
        }
        if (!missing.isEmpty()) {
            log.warn("requireNetworks: missing {}", missing);
            throw new EntityNotFoundException("Blockchain networks with names " + missing + " not found");
        }
    }

    public static List<Long> ids(Collection<TokenEntity> tokens) {
        List<Long> out = new ArrayList<>(tokens.size());
        for (TokenEntity t : tokens) out.add(t.getId());
        return out;
    }
}
