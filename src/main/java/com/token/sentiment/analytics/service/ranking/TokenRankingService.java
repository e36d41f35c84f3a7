package com.token.sentiment.analytics.service.ranking;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.SentimentMath;
import com.token.sentiment.analytics.common.exception.EntityNotFoundException;
import com.token.sentiment.analytics.common.exception.ValidationException;
import com.token.sentiment.analytics.dto.TokenMentionCountRow;
import com.token.sentiment.analytics.dto.UserActivityRow;
import com.token.sentiment.analytics.model.dto.*;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.PostRepository;
import com.token.sentiment.analytics.repo.SentimentLabelRepository;
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

import java.util.ArrayList;
import java.util.List;

/**
 * Rankings by mention volume: tokens, and authors around a token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TokenRankingService {

    private final TokenRepository tokenRepository;
    private final TokenMentionRepository mentionRepository;
    private final SentimentLabelRepository sentimentRepository;
    private final PostRepository postRepository;
    private final TokenResolver tokenResolver;
    private final TimeWindowResolver windowResolver;
    private final SentimentStatsService statsService;

    /**
     * @param network optional; restricts the ranking to tokens on that network
     */
    public MostDiscussedTokens getMostDiscussedTokens(int daysBack, int limit, int minMentions, String network) {
        Guards.requirePositive("limit", limit);
        Guards.requirePositive("min_mentions", minMentions);
        TimeWindow window = windowResolver.resolve(daysBack);
        String net = Guards.hasText(network) ? network : null;
        if (net != null) tokenResolver.requireNetwork(net);

        PageRequest page = PageRequest.of(0, limit);
        List<TokenMentionCountRow> rows = net == null
                ? mentionRepository.countTokenMentions(window.start(), window.end(), minMentions, page)
                : mentionRepository.countTokenMentionsOnNetwork(net, window.start(), window.end(), minMentions, page);

        List<DiscussedToken> tokens = new ArrayList<>(rows.size());
        for (TokenMentionCountRow r : rows) {
            tokens.add(new DiscussedToken(r.tokenId(), r.symbol(), r.name(), r.network(), r.count(),
                    statsService.distribution(List.of(r.tokenId()), window)));
        }
        log.info("getMostDiscussedTokens({}d, limit={}, min={}, network={}): {} token(s)",
                daysBack, limit, minMentions, net, tokens.size());
        return new MostDiscussedTokens(window.period(), net, tokens);
    }

    public TopUsers getTopUsersByToken(TokenSelector selector, int daysBack, int limit) {
        List<TokenEntity> tokens = tokenResolver.resolve(selector);
        Guards.requirePositive("limit", limit);
        TimeWindow window = windowResolver.resolve(daysBack);
        List<Long> ids = TokenResolver.ids(tokens);

        List<UserActivity> users = new ArrayList<>();
        for (UserActivityRow r : postRepository.findTopAuthors(ids, window.start(), window.end(), PageRequest.of(0, limit))) {
            long posts = r.postCount();
            double engagement = posts > 0 ? (r.likes() + 2.0 * r.reshares()) / posts : 0.0;
            double influence = engagement * posts / 1000.0;
            SentimentDistribution d = SentimentDistribution.fromRows(
                    sentimentRepository.countByAuthorAndTokens(r.authorId(), ids, window.start(), window.end()));
            users.add(new UserActivity(r.authorId(), r.username(), posts, r.likes(), r.reshares(),
                    SentimentMath.round(engagement, 2), SentimentMath.round(influence, 2), d));
        }

        TokenEntity first = tokens.get(0);
        String symbol = Guards.hasText(selector.symbol()) ? selector.symbol() : first.getSymbol();
        String network = Guards.hasText(selector.network()) ? selector.network()
                : (Guards.hasText(selector.symbol()) ? null : first.getNetworkName());
        return new TopUsers(new TokenKey(symbol, network).displayName(), network, window.period(), users);
    }

    public TokenMentionStats getTokenMentionStats(Long tokenId) {
        if (tokenId == null) throw new ValidationException("Must provide token_id");
        TokenEntity token = tokenRepository.findById(tokenId)
                .orElseThrow(() -> new EntityNotFoundException("Token", tokenId));
        long count = mentionRepository.countByToken_Id(tokenId);
        SentimentDistribution d = SentimentDistribution.fromRows(sentimentRepository.countByTokenAllTime(tokenId));
        return new TokenMentionStats(token.getId(), token.getSymbol(), token.getName(), token.getNetworkName(), count,
                mentionRepository.findFirstMentionedAt(tokenId), mentionRepository.findLastMentionedAt(tokenId), d);
    }
}
