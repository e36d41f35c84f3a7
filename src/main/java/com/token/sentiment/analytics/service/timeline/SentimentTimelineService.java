package com.token.sentiment.analytics.service.timeline;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.config.AnalyticsProperties;
import com.token.sentiment.analytics.dto.NamedCountRow;
import com.token.sentiment.analytics.dto.NetworkSentimentRow;
import com.token.sentiment.analytics.dto.SentimentPointRow;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.enums.TimeInterval;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.model.entity.NetworkEntity;
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

import java.util.*;

/**
 * Bucketed sentiment timelines for a token, a network, or every mention.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SentimentTimelineService {

    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final SentimentLabelRepository sentimentRepository;
    private final TokenMentionRepository mentionRepository;
    private final AnalyticsProperties properties;

    public SentimentTimeline getTokenSentimentTimeline(TokenSelector selector, int daysBack, String interval) {
        TimeInterval ti = TimeInterval.parse(interval);
        List<TokenEntity> tokens = tokenResolver.resolve(selector);
        TimeWindow window = windowResolver.resolve(daysBack);

        List<SentimentPointRow> rows = sentimentRepository.findPointsByTokens(
                TokenResolver.ids(tokens), window.start(), window.end());
        List<TimelinePoint> points = TimelineBuilder.build(rows, ti);
        log.debug("getTokenSentimentTimeline({}, {}): {} rows -> {} points", selector, ti, rows.size(), points.size());

        String symbol = Guards.hasText(selector.symbol()) ? selector.symbol() : tokens.get(0).getSymbol();
        String network = Guards.hasText(selector.network()) ? selector.network()
                : (Guards.hasText(selector.symbol()) ? null : tokens.get(0).getNetworkName());
        return new SentimentTimeline(symbol, network, window.period(), ti, points);
    }

    public NetworkTimeline getNetworkSentimentTimeline(String network, int daysBack, String interval) {
        TimeInterval ti = TimeInterval.parse(interval);
        Guards.requirePositive("days_back", daysBack);
        NetworkEntity entity = tokenResolver.requireNetwork(network);
        TimeWindow window = windowResolver.resolve(daysBack);

        List<TimelinePoint> points = TimelineBuilder.build(
                sentimentRepository.findPointsByNetwork(network, window.start(), window.end()), ti);

        List<MentionCount> topTokens = new ArrayList<>();
        for (NamedCountRow r : mentionRepository.countSymbolMentionsInNetworks(List.of(network),
                window.start(), window.end(), 0L, PageRequest.of(0, properties.getNetworkTimelineTopTokens()))) {
            topTokens.add(new MentionCount(r.name(), r.count()));
        }

        String displayName = Guards.hasText(entity.getDisplayName()) ? entity.getDisplayName() : network;
        return new NetworkTimeline(network, displayName, window.period(), ti,
                TimelineBuilder.total(points), topTokens, points);
    }

    /**
     * @param topNetworks when not null, only mentions of tokens on the N most mentioned networks count
     */
    public GlobalSentimentTrends getGlobalSentimentTrends(int daysBack, String interval, Integer topNetworks) {
        TimeInterval ti = TimeInterval.parse(interval);
        if (topNetworks != null) Guards.requirePositive("top_networks", topNetworks);
        TimeWindow window = windowResolver.resolve(daysBack);

        List<String> included = new ArrayList<>();
        if (topNetworks != null) {
            for (NamedCountRow r : mentionRepository.countMentionsByNetwork(window.start(), window.end(), 0L,
                    PageRequest.of(0, topNetworks))) {
                included.add(r.name());
            }
        }

        List<SentimentPointRow> rows;
        List<NetworkSentimentRow> byNetwork;
        if (topNetworks == null) {
            rows = sentimentRepository.findPoints(window.start(), window.end());
            byNetwork = sentimentRepository.countGroupedByNetwork(window.start(), window.end());
        } else if (included.isEmpty()) {
            rows = List.of();
            byNetwork = List.of();
        } else {
            rows = sentimentRepository.findPointsInNetworks(included, window.start(), window.end());
            byNetwork = sentimentRepository.countGroupedByNetworkIn(included, window.start(), window.end());
        }

        List<TimelinePoint> points = TimelineBuilder.build(rows, ti);
        List<NetworkBreakdown> networkSentiment = networkBreakdowns(byNetwork);
        log.info("getGlobalSentimentTrends({}d, {}): {} points, {} networks", daysBack, ti, points.size(),
                networkSentiment.size());
        return new GlobalSentimentTrends(window.period(), ti, TimelineBuilder.total(points), points,
                networkSentiment, included);
    }

    static List<NetworkBreakdown> networkBreakdowns(List<NetworkSentimentRow> rows) {
        Map<String, Map<Sentiment, Long>> grouped = new LinkedHashMap<>();
        for (NetworkSentimentRow r : rows) {
            grouped.computeIfAbsent(r.network(), k -> new EnumMap<>(Sentiment.class))
                    .merge(r.sentiment(), r.count(), Long::sum);
        }
        List<NetworkBreakdown> out = new ArrayList<>();
        grouped.forEach((network, counts) ->
                out.add(new NetworkBreakdown(network, SentimentDistribution.fromCounts(counts))));
        out.sort(Comparator.comparingLong((NetworkBreakdown b) -> b.sentiment().total()).reversed()
                .thenComparing(NetworkBreakdown::network));
        return out;
    }
}
