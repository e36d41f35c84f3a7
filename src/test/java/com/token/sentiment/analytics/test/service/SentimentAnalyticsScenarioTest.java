package com.token.sentiment.analytics.test.service;

import com.token.sentiment.analytics.common.exception.EntityNotFoundException;
import com.token.sentiment.analytics.common.exception.ValidationException;
import com.token.sentiment.analytics.config.AnalyticsProperties;
import com.token.sentiment.analytics.enums.Sentiment;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.repo.*;
import com.token.sentiment.analytics.service.TokenResolver;
import com.token.sentiment.analytics.service.compare.SentimentComparisonService;
import com.token.sentiment.analytics.service.correlation.TokenCorrelationService;
import com.token.sentiment.analytics.service.matrix.NetworkTokenMatrixService;
import com.token.sentiment.analytics.service.momentum.SentimentMomentumService;
import com.token.sentiment.analytics.service.ranking.TokenRankingService;
import com.token.sentiment.analytics.service.sentiment.SentimentStatsService;
import com.token.sentiment.analytics.service.similarity.SimilarTokenService;
import com.token.sentiment.analytics.service.timeline.SentimentTimelineService;
import com.token.sentiment.analytics.service.window.TimeWindowResolver;
import com.token.sentiment.analytics.test.ScenarioData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs every analytics operation against the seeded dataset on an embedded database.
 */
@DataJpaTest
@ActiveProfiles("test")
class SentimentAnalyticsScenarioTest {

    @Autowired
    TestEntityManager em;
    @Autowired
    TokenRepository tokenRepository;
    @Autowired
    NetworkRepository networkRepository;
    @Autowired
    TokenMentionRepository mentionRepository;
    @Autowired
    SentimentLabelRepository sentimentRepository;
    @Autowired
    PostRepository postRepository;

    ScenarioData data;
    SentimentStatsService stats;
    SentimentTimelineService timelines;
    SentimentComparisonService comparisons;
    TokenRankingService rankings;
    TokenCorrelationService correlations;
    SentimentMomentumService momentum;
    NetworkTokenMatrixService matrix;
    SimilarTokenService similar;

    @BeforeEach
    void setUp() {
        data = new ScenarioData(em).seed();

        AnalyticsProperties props = new AnalyticsProperties();
        TimeWindowResolver windows = new TimeWindowResolver(ScenarioData.CLOCK);
        TokenResolver tokens = new TokenResolver(tokenRepository, networkRepository);
        stats = new SentimentStatsService(tokens, windows, sentimentRepository);
        timelines = new SentimentTimelineService(tokens, windows, sentimentRepository, mentionRepository, props);
        comparisons = new SentimentComparisonService(tokenRepository, mentionRepository, sentimentRepository,
                postRepository, tokens, windows, stats, props);
        rankings = new TokenRankingService(tokenRepository, mentionRepository, sentimentRepository, postRepository,
                tokens, windows, stats);
        correlations = new TokenCorrelationService(tokens, windows, mentionRepository, sentimentRepository);
        momentum = new SentimentMomentumService(tokenRepository, mentionRepository, tokens, windows, stats);
        matrix = new NetworkTokenMatrixService(windows, mentionRepository, sentimentRepository);
        similar = new SimilarTokenService(tokenRepository);
    }

    @Test
    void solStatsOverSevenDays() {
        SentimentStats s = stats.getTokenSentimentStats(TokenSelector.bySymbol("SOL"), 7);

        assertThat(s.totalMentions()).isEqualTo(10);
        assertThat(s.breakdown(Sentiment.POSITIVE).count()).isEqualTo(5);
        assertThat(s.breakdown(Sentiment.POSITIVE).percentage()).isEqualTo(50.0);
        assertThat(s.breakdown(Sentiment.POSITIVE).avgConfidence()).isEqualTo(0.85);
        assertThat(s.breakdown(Sentiment.NEUTRAL).percentage()).isEqualTo(30.0);
        assertThat(s.breakdown(Sentiment.NEGATIVE).percentage()).isEqualTo(20.0);
        assertThat(s.sentimentScore()).isEqualTo(0.3);
        assertThat(s.period()).isEqualTo("2024-06-08 to 2024-06-15");
    }

    @Test
    void symbolWithoutNetworkUnionsAllNetworks() {
        assertThat(stats.getTokenSentimentStats(TokenSelector.bySymbol("USDC"), 7).totalMentions()).isEqualTo(7);
        assertThat(stats.getTokenSentimentStats(TokenSelector.bySymbol("USDC", "ethereum"), 7).totalMentions()).isEqualTo(3);
        SentimentStats byId = stats.getTokenSentimentStats(TokenSelector.byId(data.usdcSolana.getId()), 7);
        assertThat(byId.totalMentions()).isEqualTo(4);
        assertThat(byId.token()).isEqualTo("USDC (solana)");
    }

    @Test
    void validTokenWithoutMentionsYieldsZeroes() {
        SentimentStats s = stats.getTokenSentimentStats(TokenSelector.bySymbol("BONK"), 7);

        assertThat(s.totalMentions()).isZero();
        assertThat(s.sentimentScore()).isZero();
        for (Sentiment c : Sentiment.values()) {
            assertThat(s.breakdown(c).percentage()).isZero();
            assertThat(s.breakdown(c).avgConfidence()).isZero();
        }
    }

    @Test
    void unknownEntitiesAreNotFound() {
        assertThatThrownBy(() -> stats.getTokenSentimentStats(TokenSelector.bySymbol("DOGE"), 7))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> stats.getTokenSentimentStats(TokenSelector.bySymbol("SOL", "ethereum"), 7))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> stats.getTokenSentimentStats(TokenSelector.byId(data.sol.getId(), "ethereum"), 7))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> timelines.getNetworkSentimentTimeline("cosmos", 7, "day"))
                .isInstanceOf(EntityNotFoundException.class);
        assertThatThrownBy(() -> comparisons.compareNetworkSentiments(List.of("solana", "cosmos"), 7, 0, 0))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("cosmos");
    }

    @Test
    void dailyTimelineIsChronologicalAndSumsUp() {
        SentimentTimeline t = timelines.getTokenSentimentTimeline(TokenSelector.bySymbol("SOL"), 7, "Day");

        assertThat(t.points()).extracting(TimelinePoint::label)
                .containsExactly("2024-06-13", "2024-06-14", "2024-06-15");
        assertThat(t.points()).extracting(TimelinePoint::total).containsExactly(4L, 4L, 2L);
        for (TimelinePoint p : t.points()) {
            assertThat(p.count(Sentiment.POSITIVE) + p.count(Sentiment.NEGATIVE) + p.count(Sentiment.NEUTRAL))
                    .isEqualTo(p.total());
            assertThat(p.sentimentScore()).isBetween(-1.0, 1.0);
        }

        assertThatThrownBy(() -> timelines.getTokenSentimentTimeline(TokenSelector.bySymbol("SOL"), 7, "minute"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void networkTimelineAndGlobalTrends() {
        NetworkTimeline n = timelines.getNetworkSentimentTimeline("solana", 7, "day");
        assertThat(n.displayName()).isEqualTo("Solana");
        assertThat(n.totalMentions()).isEqualTo(18);
        assertThat(n.topTokens()).extracting(MentionCount::label).containsExactly("SOL", "RAY", "USDC");

        GlobalSentimentTrends all = timelines.getGlobalSentimentTrends(7, "week", null);
        assertThat(all.totalMentions()).isEqualTo(21);
        assertThat(all.networkSentiment()).extracting(NetworkBreakdown::network).containsExactly("solana", "ethereum");
        assertThat(all.networksIncluded()).isEmpty();

        GlobalSentimentTrends top = timelines.getGlobalSentimentTrends(7, "day", 1);
        assertThat(top.networksIncluded()).containsExactly("solana");
        assertThat(top.totalMentions()).isEqualTo(18);
    }

    @Test
    void tokenComparisonDisambiguatesSharedSymbols() {
        TokenComparison c = comparisons.compareTokenSentiments(List.of("SOL", "USDC"), null, null, 7);

        assertThat(c.tokens()).hasSize(3);
        assertThat(c.tokens().get(0).displayKey()).isEqualTo("SOL");
        assertThat(c.byDisplayKey()).containsKeys("USDC (solana)", "USDC (ethereum)");
        assertThat(c.byDisplayKey().get("USDC (ethereum)").totalMentions()).isEqualTo(3);

        TokenComparison paired = comparisons.compareTokenSentiments(List.of("SOL", "USDC"), null,
                List.of("solana", "ethereum"), 7);
        assertThat(paired.tokens()).extracting(TokenSentiment::displayKey).containsExactly("SOL", "USDC");

        assertThatThrownBy(() -> comparisons.compareTokenSentiments(List.of("SOL", "DOGE", "PEPE"), null, null, 7))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining("DOGE")
                .hasMessageContaining("PEPE");
        assertThatThrownBy(() -> comparisons.compareTokenSentiments(List.of("SOL"), List.of(1L, 2L), null, 7))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void networkComparisonSortedByVolume() {
        NetworkComparison c = comparisons.compareNetworkSentiments(List.of("ethereum", "solana"), 7, 1, 1);

        assertThat(c.networks()).extracting(NetworkSentiment::network).containsExactly("solana", "ethereum");
        assertThat(c.networks().get(0).totalTokens()).isEqualTo(3);
        assertThat(c.networks().get(0).topTokens().get(0).symbol()).isEqualTo("SOL");

        NetworkComparison strict = comparisons.compareNetworkSentiments(List.of("ethereum", "solana"), 7, 2, 1);
        assertThat(strict.networks()).extracting(NetworkSentiment::network).containsExactly("solana");
    }

    @Test
    void symbolAcrossNetworks() {
        CrossNetworkComparison c = comparisons.compareTokenAcrossNetworks("USDC", null, 7);

        assertThat(c.networkCount()).isEqualTo(2);
        assertThat(c.totalMentionsAllNetworks()).isEqualTo(7);
        assertThat(c.networks()).extracting(NetworkTokenSentiment::network).containsExactly("solana", "ethereum");
        assertThat(c.networks()).extracting(NetworkTokenSentiment::popularityPercentage).containsExactly(57.1, 42.9);
        assertThat(c.networks().get(1).topUsers()).containsExactly(new MentionCount("carol", 3));
        assertThat(c.networks().get(1).dailyMentions()).containsExactly(new MentionCount("2024-06-14", 3));
    }

    @Test
    void mostDiscussedIsSortedByMentions() {
        MostDiscussedTokens m = rankings.getMostDiscussedTokens(7, 10, 1, null);

        List<DiscussedToken> tokens = m.tokens();
        assertThat(tokens).hasSize(4);
        for (int i = 1; i < tokens.size(); i++) {
            assertThat(tokens.get(i - 1).mentionCount()).isGreaterThanOrEqualTo(tokens.get(i).mentionCount());
        }
        assertThat(tokens.get(0).sentiment().total()).isEqualTo(tokens.get(0).mentionCount());
        assertThat(tokens.get(1).displayName()).isEqualTo("USDC (solana)");

        assertThat(rankings.getMostDiscussedTokens(7, 10, 1, "ethereum").tokens()).hasSize(1);
    }

    @Test
    void topUsersCarryEngagementHeuristics() {
        TopUsers u = rankings.getTopUsersByToken(TokenSelector.bySymbol("SOL"), 7, 10);

        assertThat(u.users()).extracting(UserActivity::username).containsExactly("alice", "bob");
        UserActivity alice = u.users().get(0);
        assertThat(alice.engagementRate()).isEqualTo(12.0);
        assertThat(alice.influenceScore()).isEqualTo(0.06);
        assertThat(alice.sentiment().total()).isEqualTo(5);
    }

    @Test
    void mentionStatsAreAllTime() {
        TokenMentionStats s = rankings.getTokenMentionStats(data.sol.getId());

        assertThat(s.mentionCount()).isEqualTo(11);
        assertThat(s.firstSeen()).isEqualTo(ScenarioData.NOW.minus(Duration.ofDays(20)));
        assertThat(s.sentiment().count(Sentiment.POSITIVE)).isEqualTo(6);

        assertThatThrownBy(() -> rankings.getTokenMentionStats(-1L)).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void correlationWithinBounds() {
        CorrelationReport r = correlations.analyzeTokenCorrelation("SOL", null, 7, 1, 10);

        assertThat(r.primaryToken().totalMentions()).isEqualTo(10);
        assertThat(r.correlatedTokens()).extracting(CorrelatedToken::displayName)
                .containsExactly("USDC (solana)", "RAY (solana)");
        assertThat(r.correlatedTokens()).extracting(CorrelatedToken::correlationPercentage).containsExactly(40.0, 20.0);
        for (CorrelatedToken t : r.correlatedTokens()) {
            assertThat(t.coMentionCount()).isLessThanOrEqualTo(r.primaryToken().totalMentions());
            assertThat(t.correlationPercentage()).isBetween(0.0, 100.0);
        }
        assertThat(r.correlatedTokens().get(0).combinedSentiment().count(Sentiment.POSITIVE)).isEqualTo(4);

        assertThat(correlations.analyzeTokenCorrelation("SOL", null, 7, 3, 10).correlatedTokens()).hasSize(1);
    }

    @Test
    void momentumFromNothingIsUnboundedGrowth() {
        MomentumReport r = momentum.getSentimentMomentum(List.of("RAY"), null, 5, 6, 1);

        assertThat(r.tokens()).hasSize(1);
        TokenMomentum ray = r.tokens().get(0);
        assertThat(ray.period1().total()).isZero();
        assertThat(ray.period2().total()).isEqualTo(4);
        assertThat(ray.mentionGrowth().unbounded()).isTrue();
        assertThat(ray.momentum()).isEqualTo(-0.75);
    }

    @Test
    void autoSelectedMomentumIsSortedDescending() {
        MomentumReport r = momentum.getSentimentMomentum(null, null, 10, 6, 1);

        List<TokenMomentum> tokens = r.tokens();
        assertThat(tokens).isNotEmpty();
        for (int i = 1; i < tokens.size(); i++) {
            assertThat(tokens.get(i - 1).momentum()).isGreaterThanOrEqualTo(tokens.get(i).momentum());
        }
    }

    @Test
    void matrixMarksMissingPairsAbsent() {
        SentimentMatrix m = matrix.getNetworkTokenSentimentMatrix(10, 5, 7, 1);

        assertThat(m.networks()).containsExactly("solana", "ethereum");
        assertThat(m.tokens()).containsExactly("SOL", "USDC", "RAY");
        MatrixRow sol = m.rows().get(0);
        assertThat(sol.cell("ethereum").present()).isFalse();
        assertThat(sol.cell("solana").mentions()).isEqualTo(10);
        assertThat(m.rows().get(1).cell("ethereum").mentions()).isEqualTo(3);

        // ethereum has only 3 mentions
        SentimentMatrix strict = matrix.getNetworkTokenSentimentMatrix(10, 5, 7, 4);
        assertThat(strict.networks()).containsExactly("solana");
        assertThat(strict.tokens()).containsExactly("SOL", "RAY", "USDC");
    }

    @Test
    void similarSymbols() {
        assertThat(similar.findSimilarTokens("usd", 0.7, null))
                .extracting(SimilarToken::similarity).containsExactly(0.75, 0.75);
        assertThat(similar.findSimilarTokens(" sol ", 1.0, null))
                .extracting(SimilarToken::symbol).containsExactly("SOL");
        assertThat(similar.findSimilarTokens("SOL", 0.0, data.sol.getId())).isEmpty();
    }
}
