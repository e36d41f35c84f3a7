package com.token.sentiment.analytics.service.matrix;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.dto.NamedCountRow;
import com.token.sentiment.analytics.dto.TokenNetworkSentimentRow;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
import com.token.sentiment.analytics.repo.TokenMentionRepository;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;

/**
 * Token x network sentiment grid over the most mentioned networks and symbols.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class NetworkTokenMatrixService {

    private final TimeWindowResolver windowResolver;
    private final TokenMentionRepository mentionRepository;
    private final SentimentLabelRepository sentimentRepository;

    public SentimentMatrix getNetworkTokenSentimentMatrix(int topNTokens, int topNNetworks, int daysBack,
                                                          int minMentions) {
        Guards.requirePositive("top_n_tokens", topNTokens);
        Guards.requirePositive("top_n_networks", topNNetworks);
        Guards.requirePositive("min_mentions", minMentions);
        TimeWindow window = windowResolver.resolve(daysBack);

        List<String> networks = names(mentionRepository.countMentionsByNetwork(
                window.start(), window.end(), minMentions, PageRequest.of(0, topNNetworks)));
        if (networks.isEmpty()) return SentimentMatrix.empty(window.period());

        List<String> symbols = names(mentionRepository.countSymbolMentionsInNetworks(
                networks, window.start(), window.end(), minMentions, PageRequest.of(0, topNTokens)));
        if (symbols.isEmpty()) return SentimentMatrix.empty(window.period());

        Map<String, Map<String, Map<Sentiment, Long>>> counts = new HashMap<>();
        for (TokenNetworkSentimentRow r : sentimentRepository.countGroupedBySymbolAndNetwork(
                symbols, networks, window.start(), window.end())) {
            counts.computeIfAbsent(r.symbol(), k -> new HashMap<>())
                    .computeIfAbsent(r.network(), k -> new EnumMap<>(Sentiment.class))
                    .merge(r.sentiment(), r.count(), Long::sum);
        }

        Map<String, Map<String, MatrixCell>> grid = new HashMap<>();
        Map<String, Long> tokenTotals = new HashMap<>();
        Map<String, Long> networkTotals = new HashMap<>();
        for (String symbol : symbols) {
            Map<String, MatrixCell> cells = new HashMap<>();
            for (String network : networks) {
                Map<Sentiment, Long> c = counts.getOrDefault(symbol, Map.of()).get(network);
                MatrixCell cell = MatrixCell.absent();
                if (c != null) {
                    SentimentDistribution d = SentimentDistribution.fromCounts(c);
                    if (d.total() >= minMentions) cell = MatrixCell.present(d);
                }
                cells.put(network, cell);
                tokenTotals.merge(symbol, cell.mentions(), Long::sum);
                networkTotals.merge(network, cell.mentions(), Long::sum);
            }
            grid.put(symbol, cells);
        }

        List<String> columns = new ArrayList<>(networks);
        columns.sort(Comparator.comparingLong((String n) -> networkTotals.get(n)).reversed());
        List<String> tokens = new ArrayList<>(symbols);
        tokens.sort(Comparator.comparingLong((String s) -> tokenTotals.get(s)).reversed());

        List<MatrixRow> rows = new ArrayList<>(tokens.size());
        for (String symbol : tokens) {
            Map<String, MatrixCell> ordered = new LinkedHashMap<>();
            for (String network : columns) ordered.put(network, grid.get(symbol).get(network));
            rows.add(new MatrixRow(symbol, Collections.unmodifiableMap(ordered)));
        }
        log.info("getNetworkTokenSentimentMatrix: {} token(s) x {} network(s)", tokens.size(), columns.size());
        return new SentimentMatrix(window.period(), columns, tokens, rows);
    }

    private static List<String> names(List<NamedCountRow> rows) {
        List<String> out = new ArrayList<>(rows.size());
        for (NamedCountRow r : rows) out.add(r.name());
        return out;
    }
}
