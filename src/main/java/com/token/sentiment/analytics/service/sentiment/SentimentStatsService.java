package com.token.sentiment.analytics.service.sentiment;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.model.dto.SentimentDistribution;
import com.token.sentiment.analytics.model.dto.SentimentStats;
import com.token.sentiment.analytics.model.dto.TimeWindow;
import com.token.sentiment.analytics.model.dto.TokenSelector;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
import com.token.sentiment.analytics.service.TokenResolver;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Per-token sentiment statistics. The distribution builder here is shared by the other analytics services.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SentimentStatsService {

    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final SentimentLabelRepository sentimentRepository;

    public SentimentStats getTokenSentimentStats(TokenSelector selector, int daysBack) {
        List<TokenEntity> tokens = tokenResolver.resolve(selector);
        TimeWindow window = windowResolver.resolve(daysBack);
        SentimentDistribution d = distribution(TokenResolver.ids(tokens), window);
        log.debug("getTokenSentimentStats({}): {} mentions over {} token(s)", selector, d.total(), tokens.size());
        return new SentimentStats(displayToken(selector, tokens), networkOf(selector, tokens), window.period(), d);
    }

    public SentimentDistribution distribution(Collection<Long> tokenIds, TimeWindow window) {
        if (tokenIds.isEmpty()) return SentimentDistribution.empty();
        return SentimentDistribution.fromRows(sentimentRepository.countByTokens(tokenIds, window.start(), window.end()));
    }

    private static String displayToken(TokenSelector selector, List<TokenEntity> tokens) {
        String network = networkOf(selector, tokens);
        String symbol = Guards.hasText(selector.symbol()) ? selector.symbol() : tokens.get(0).getSymbol();
        return network == null ? symbol : symbol + " (" + network + ")";
    }

    private static String networkOf(TokenSelector selector, List<TokenEntity> tokens) {
        if (Guards.hasText(selector.network())) return selector.network();
        if (!Guards.hasText(selector.symbol())) return tokens.get(0).getNetworkName();
        return null;
    }
}
