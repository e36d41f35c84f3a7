package com.token.sentiment.analytics.service.momentum;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.SentimentMath;
import com.token.sentiment.analytics.common.exception.EntityNotFoundException;
import com.token.sentiment.analytics.dto.TokenPairCountRow;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.TokenMentionRepository;
import com.token.sentiment.analytics.repo.TokenRepository;
import com.token.sentiment.analytics.service.TokenResolver;
import com.token.sentiment.analytics.service.sentiment.SentimentStatsService;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Change of sentiment between the two halves of a window, per (symbol, network).
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SentimentMomentumService {

    private final TokenRepository tokenRepository;
    private final TokenMentionRepository mentionRepository;
    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final SentimentStatsService statsService;

    /**
     * @param symbols     explicit candidates; when empty the {@code topN} most mentioned (symbol, network)
     *                    pairs of the whole window are used
     * @param networks    paired 1:1 with {@code symbols} when the lengths match, otherwise a network filter
     * @param minMentions candidates need this many mentions to be auto-selected, and
     *                    {@code minMentions / 2} in each half to be reported
     */
    public MomentumReport getSentimentMomentum(List<String> symbols, List<String> networks, int topN,
                                               int daysBack, int minMentions) {
        Guards.requirePositive("top_n", topN);
        Guards.requirePositive("min_mentions", minMentions);
        SplitWindow split = windowResolver.split(daysBack);
        List<String> nets = networks == null ? List.of() : networks;

        Collection<TokenKey> candidates = symbols == null || symbols.isEmpty()
                ? topCandidates(split.whole(), nets, topN, minMentions)
                : explicitCandidates(symbols, nets);

        long threshold = minMentions / 2;
        List<TokenMomentum> out = new ArrayList<>();
        for (TokenKey key : candidates) {
            List<Long> ids = TokenResolver.ids(tokenResolver.resolveKey(key));
            if (ids.isEmpty()) continue;
            SentimentDistribution p1 = statsService.distribution(ids, split.first());
            SentimentDistribution p2 = statsService.distribution(ids, split.second());
            if (p1.total() < threshold || p2.total() < threshold) {
                log.debug("getSentimentMomentum: dropping {} ({} / {} mentions)", key.displayName(), p1.total(), p2.total());
                continue;
            }
            double momentum = SentimentMath.round(p2.rawScore() - p1.rawScore(), 3);
            out.add(new TokenMomentum(key, p1, p2, momentum, MentionGrowth.between(p1.total(), p2.total())));
        }
        out.sort(Comparator.comparingDouble(TokenMomentum::momentum).reversed());
        log.info("getSentimentMomentum({}d): {} candidate(s), {} reported", daysBack, candidates.size(), out.size());
        return new MomentumReport(split.first().period(), split.second().period(), out);
    }

    private Collection<TokenKey> topCandidates(TimeWindow window, List<String> networks, int topN, int minMentions) {
        PageRequest page = PageRequest.of(0, topN);
        List<TokenPairCountRow> rows = networks.isEmpty()
                ? mentionRepository.countTokenPairs(window.start(), window.end(), minMentions, page)
                : mentionRepository.countTokenPairsInNetworks(networks, window.start(), window.end(), minMentions, page);
        Set<TokenKey> keys = new LinkedHashSet<>();
        for (TokenPairCountRow r : rows) keys.add(new TokenKey(r.symbol(), r.network()));
        return keys;
    }

    /**
     * Every symbol is validated first. A symbol without a network expands to each network hosting it.
     */
    private Collection<TokenKey> explicitCandidates(List<String> symbols, List<String> networks) {
        boolean paired = networks.size() == symbols.size();
        Set<TokenKey> keys = new LinkedHashSet<>();
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = symbols.get(i);
            List<TokenEntity> tokens;
            if (paired) {
                String net = Guards.hasText(networks.get(i)) ? networks.get(i) : null;
                tokens = tokenResolver.resolveSymbol(symbol, net);
            } else if (!networks.isEmpty()) {
                tokens = tokenRepository.findBySymbolAndNetwork_NameIn(symbol, networks);
                if (tokens.isEmpty()) {
                    throw new EntityNotFoundException("Token with symbol '" + symbol + "' not found in specified networks");
                }
            } else {
                tokens = tokenResolver.resolveSymbol(symbol, null);
            }
            for (TokenEntity t : tokens) keys.add(TokenKey.of(t));
        }
        return keys;
    }
}
