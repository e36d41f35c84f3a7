package com.token.sentiment.analytics.service.correlation;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.SentimentMath;
import com.token.sentiment.analytics.dto.TokenMentionCountRow;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
import com.token.sentiment.analytics.repo.TokenMentionRepository;
import com.token.sentiment.analytics.service.TokenResolver;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds tokens that are mentioned in the same posts as a primary token.
 * <p>
 * The primary symbol may resolve to tokens on several networks; all of them together form the primary
 * subject and are excluded from the candidates. Sub-queries run in sequence and are not atomic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TokenCorrelationService {

    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final TokenMentionRepository mentionRepository;
    private final SentimentLabelRepository sentimentRepository;

    public CorrelationReport analyzeTokenCorrelation(String symbol, String network, int daysBack,
                                                     int minCoMentions, int limit) {
        Guards.requirePositive("min_co_mentions", minCoMentions);
        Guards.requirePositive("limit", limit);
        TimeWindow window = windowResolver.resolve(daysBack);
        String net = Guards.hasText(network) ? network : null;
        List<TokenEntity> primary = tokenResolver.resolve(TokenSelector.bySymbol(symbol, net));
        List<Long> primaryIds = TokenResolver.ids(primary);

        long primaryMentions = mentionRepository.countMentions(primaryIds, window.start(), window.end());
        List<TokenMentionCountRow> rows = mentionRepository.findCoMentionedTokens(
                primaryIds, window.start(), window.end(), minCoMentions, PageRequest.of(0, limit));

        List<CorrelatedToken> correlated = new ArrayList<>(rows.size());
        for (TokenMentionCountRow r : rows) {
            SentimentDistribution combined = SentimentDistribution.fromRows(
                    sentimentRepository.countCombined(primaryIds, r.tokenId(), window.start(), window.end()));
            correlated.add(new CorrelatedToken(r.tokenId(), r.symbol(), r.name(), r.network(), r.count(),
                    SentimentMath.percentage(r.count(), primaryMentions), combined));
        }
        log.info("analyzeTokenCorrelation({}, {}): {} primary mentions, {} correlated", symbol, net,
                primaryMentions, correlated.size());

        return new CorrelationReport(new PrimaryToken(primaryIds, symbol, net, primaryMentions),
                window.period(), correlated);
    }
}
