package com.token.sentiment.analytics.service.compare;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.SentimentMath;
import com.token.sentiment.analytics.common.exception.EntityNotFoundException;
import com.token.sentiment.analytics.common.exception.ValidationException;
import com.token.sentiment.analytics.config.AnalyticsProperties;
import com.token.sentiment.analytics.dto.TokenMentionCountRow;
import com.token.sentiment.analytics.dto.UserActivityRow;
import com.token.sentiment.analytics.enums.TimeInterval;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.PostRepository;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
import com.token.sentiment.analytics.repo.TokenMentionRepository;
import com.token.sentiment.analytics.repo.TokenRepository;
import com.token.sentiment.analytics.service.TokenResolver;
import com.token.sentiment.analytics.service.sentiment.SentimentStatsService;
import com.token.sentiment.analytics.service.timeline.TimelineBuilder;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Side-by-side sentiment of several tokens, several networks, or one symbol across its networks.
 * Every named entity is validated before anything is computed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SentimentComparisonService {

    private final TokenRepository tokenRepository;
    private final TokenMentionRepository mentionRepository;
    private final SentimentLabelRepository sentimentRepository;
    private final PostRepository postRepository;
    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final SentimentStatsService statsService;
    private final AnalyticsProperties properties;

    /**
     * @param networks paired 1:1 with the selectors when the lengths match, otherwise a filter applied to all of them
     */
    public TokenComparison compareTokenSentiments(List<String> symbols, List<Long> ids, List<String> networks,
                                                  int daysBack) {
        boolean haveSymbols = symbols != null && !symbols.isEmpty();
        boolean haveIds = ids != null && !ids.isEmpty();
        if (!haveSymbols && !haveIds) {
            throw new ValidationException("Must provide either token_symbols or token_ids");
        }
        if (haveSymbols && haveIds && symbols.size() != ids.size()) {
            throw new ValidationException("If both token_symbols and token_ids are provided, they must be the same length");
        }
        TimeWindow window = windowResolver.resolve(daysBack);

        int size = haveSymbols ? symbols.size() : ids.size();
        List<String> nets = networks == null ? List.of() : networks;
        boolean paired = !nets.isEmpty() && nets.size() == size;
        Set<String> filter = paired ? Set.of() : new LinkedHashSet<>(nets);

        // validate everything up front
        List<List<TokenEntity>> resolved = new ArrayList<>(size);
        List<String> missing = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            String network = paired && Guards.hasText(nets.get(i)) ? nets.get(i) : null;
            List<TokenEntity> tokens = haveSymbols
                    ? tokensForSymbol(symbols.get(i), network, filter)
                    : tokensForId(ids.get(i), network, filter);
            if (tokens.isEmpty()) {
                missing.add(haveSymbols ? symbols.get(i) : String.valueOf(ids.get(i)));
            }
            resolved.add(tokens);
        }
        if (!missing.isEmpty()) {
            String what = haveSymbols ? "Tokens with symbols " : "Tokens with IDs ";
            String where = filter.isEmpty() ? "" : " for networks " + filter;
            log.warn("compareTokenSentiments: missing {}{}", missing, where);
            throw new EntityNotFoundException(what + missing + " not found" + where);
        }

        Map<TokenKey, Set<Long>> grouped = new LinkedHashMap<>();
        for (List<TokenEntity> tokens : resolved) {
            for (TokenEntity t : tokens) {
                grouped.computeIfAbsent(TokenKey.of(t), k -> new LinkedHashSet<>()).add(t.getId());
            }
        }
        // the network is shown only when one symbol resolved to several keys; a network-less key then reads "SYM"
        Map<String, Integer> keysPerSymbol = new HashMap<>();
        for (TokenKey key : grouped.keySet()) keysPerSymbol.merge(key.symbol(), 1, Integer::sum);

        List<TokenSentiment> out = new ArrayList<>(grouped.size());
        grouped.forEach((key, tokenIds) -> {
            String displayKey = keysPerSymbol.get(key.symbol()) > 1 ? key.displayName() : key.symbol();
            out.add(new TokenSentiment(displayKey, key, statsService.distribution(tokenIds, window)));
        });
        log.info("compareTokenSentiments: {} selector(s) -> {} token key(s)", size, out.size());
        return new TokenComparison(window.period(), out);
    }

    public NetworkComparison compareNetworkSentiments(List<String> networkNames, int daysBack,
                                                      int minTokensPerNetwork, int minMentionsPerToken) {
        Guards.requireNotEmpty("network name", networkNames);
        Guards.requireNonNegative("min_tokens_per_network", minTokensPerNetwork);
        Guards.requireNonNegative("min_mentions_per_token", minMentionsPerToken);
        TimeWindow window = windowResolver.resolve(daysBack);
        tokenResolver.requireNetworks(networkNames);

        List<NetworkSentiment> out = new ArrayList<>();
        for (String network : new LinkedHashSet<>(networkNames)) {
            List<TokenMentionCountRow> tokens = mentionRepository.countTokenMentionsOnNetwork(
                    network, window.start(), window.end(), minMentionsPerToken, Pageable.unpaged());
            if (tokens.size() < minTokensPerNetwork) {
                log.debug("compareNetworkSentiments: skipping {} ({} qualifying tokens)", network, tokens.size());
                continue;
            }
            SentimentDistribution d = SentimentDistribution.fromRows(
                    sentimentRepository.countByNetwork(network, window.start(), window.end()));
            List<RankedToken> top = new ArrayList<>();
            for (TokenMentionCountRow r : tokens.subList(0, Math.min(tokens.size(), properties.getNetworkComparisonTopTokens()))) {
                top.add(new RankedToken(r.tokenId(), r.symbol(), r.count()));
            }
            out.add(new NetworkSentiment(network, tokens.size(), d, top));
        }
        out.sort(Comparator.comparingLong(NetworkSentiment::totalMentions).reversed());
        return new NetworkComparison(window.period(), out);
    }

    /**
     * Networks without mentions in the window are left out; tokens without a network are ignored.
     */
    public CrossNetworkComparison compareTokenAcrossNetworks(String symbol, List<String> networks, int daysBack) {
        if (!Guards.hasText(symbol)) {
            throw new ValidationException("Must provide token_symbol");
        }
        TimeWindow window = windowResolver.resolve(daysBack);
        boolean filtered = networks != null && !networks.isEmpty();
        List<TokenEntity> tokens = filtered
                ? tokenRepository.findBySymbolAndNetwork_NameIn(symbol, networks)
                : tokenRepository.findBySymbol(symbol);
        if (tokens.isEmpty()) {
            throw new EntityNotFoundException("Token with symbol '" + symbol + "' not found"
                    + (filtered ? " in specified networks " + networks : ""));
        }

        Map<String, List<Long>> byNetwork = new LinkedHashMap<>();
        for (TokenEntity t : tokens) {
            if (t.getNetworkName() == null) continue;
            byNetwork.computeIfAbsent(t.getNetworkName(), k -> new ArrayList<>()).add(t.getId());
        }

        List<NetworkTokenSentiment> partial = new ArrayList<>();
        long totalAll = 0;
        for (Map.Entry<String, List<Long>> e : byNetwork.entrySet()) {
            List<Long> tokenIds = e.getValue();
            SentimentDistribution d = statsService.distribution(tokenIds, window);
            if (d.total() == 0) continue;
            totalAll += d.total();

            List<MentionCount> daily = TimelineBuilder.volume(
                    mentionRepository.findMentionTimes(tokenIds, window.start(), window.end()), TimeInterval.DAY);
            List<MentionCount> users = new ArrayList<>();
            for (UserActivityRow u : postRepository.findTopAuthors(tokenIds, window.start(), window.end(),
                    PageRequest.of(0, properties.getCrossNetworkTopUsers()))) {
                users.add(new MentionCount(u.username(), u.postCount()));
            }
            partial.add(new NetworkTokenSentiment(e.getKey(), d, 0.0, daily, users));
        }

        List<NetworkTokenSentiment> out = new ArrayList<>(partial.size());
        for (NetworkTokenSentiment n : partial) {
            double share = SentimentMath.percentage(n.totalMentions(), totalAll, 1);
            out.add(new NetworkTokenSentiment(n.network(), n.sentiment(), share, n.dailyMentions(), n.topUsers()));
        }
        out.sort(Comparator.comparingLong(NetworkTokenSentiment::totalMentions).reversed());
        log.info("compareTokenAcrossNetworks({}): {} network(s), {} mentions", symbol, out.size(), totalAll);
        return new CrossNetworkComparison(symbol, window.period(), out, totalAll);
    }

    private List<TokenEntity> tokensForSymbol(String symbol, String network, Set<String> filter) {
        if (network != null) return tokenRepository.findBySymbolAndNetwork_Name(symbol, network);
        if (!filter.isEmpty()) return tokenRepository.findBySymbolAndNetwork_NameIn(symbol, filter);
        return tokenRepository.findBySymbol(symbol);
    }

    private List<TokenEntity> tokensForId(Long id, String network, Set<String> filter) {
        Optional<TokenEntity> token = id == null ? Optional.empty() : tokenRepository.findById(id);
        if (token.isEmpty()) return List.of();
        String actual = token.get().getNetworkName();
        if (network != null && !network.equals(actual)) return List.of();
        if (!filter.isEmpty() && !filter.contains(actual)) return List.of();
        return List.of(token.get());
    }
}
