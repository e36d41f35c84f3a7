package com.token.sentiment.analytics.test.repo;

import com.token.sentiment.analytics.dto.NamedCountRow;
import com.token.sentiment.analytics.dto.SentimentCountRow;
import com.token.sentiment.analytics.dto.TokenMentionCountRow;
import com.token.sentiment.analytics.dto.TokenNetworkSentimentRow;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
import com.token.sentiment.analytics.repo.TokenMentionRepository;
import com.token.sentiment.analytics.test.BaseContainers;
import com.token.sentiment.analytics.test.ScenarioData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The aggregation queries against a real PostgreSQL: enum columns, IN lists, distinct counts and paging.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
class SentimentQueriesIT extends BaseContainers {

    static final Instant END = ScenarioData.NOW;
    static final Instant START = END.minus(Duration.ofDays(7));

    @Autowired
    TestEntityManager em;
    @Autowired
    TokenMentionRepository mentionRepository;
    @Autowired
    SentimentLabelRepository sentimentRepository;

    ScenarioData data;

    @BeforeEach
    void setUp() {
        data = new ScenarioData(em).seed();
    }

    @Test
    void unionOfSymbolTokensCountsEveryMention() {
        List<SentimentCountRow> rows = sentimentRepository.countByTokens(
                List.of(data.usdcSolana.getId(), data.usdcEthereum.getId()), START, END);

        assertThat(rows.stream().mapToLong(SentimentCountRow::count).sum()).isEqualTo(7L);
        assertThat(rows).extracting(SentimentCountRow::sentiment).containsOnly(Sentiment.POSITIVE);
    }

    @Test
    void mostDiscussedAndNetworkVolumes() {
        List<TokenMentionCountRow> top = mentionRepository.countTokenMentions(START, END, 3, PageRequest.of(0, 3));
        assertThat(top).extracting(TokenMentionCountRow::symbol).containsExactly("SOL", "USDC", "RAY");

        assertThat(mentionRepository.countMentionsByNetwork(START, END, 1, Pageable.unpaged()))
                .containsExactly(new NamedCountRow("solana", 18L), new NamedCountRow("ethereum", 3L));
    }

    @Test
    void coMentionsAndCombinedSentiment() {
        List<Long> primary = List.of(data.sol.getId());

        assertThat(mentionRepository.findCoMentionedTokens(primary, START, END, 2, PageRequest.of(0, 10)))
                .extracting(TokenMentionCountRow::count).containsExactly(4L, 2L);
        List<SentimentCountRow> combined = sentimentRepository.countCombined(primary, data.usdcSolana.getId(), START, END);
        assertThat(combined).extracting(SentimentCountRow::sentiment).containsExactly(Sentiment.POSITIVE);
        assertThat(combined.get(0).count()).isEqualTo(4L);
    }

    @Test
    void symbolByNetworkGrid() {
        List<TokenNetworkSentimentRow> rows = sentimentRepository.countGroupedBySymbolAndNetwork(
                List.of("USDC"), List.of("solana", "ethereum"), START, END);

        assertThat(rows).extracting(TokenNetworkSentimentRow::network).containsExactlyInAnyOrder("solana", "ethereum");
        assertThat(rows.stream().mapToLong(TokenNetworkSentimentRow::count).sum()).isEqualTo(7L);
    }
}
