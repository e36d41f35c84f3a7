package com.token.sentiment.analytics.service.similarity;

import com.token.sentiment.analytics.common.Guards;
import com.token.sentiment.analytics.common.exception.ValidationException;
import com.token.sentiment.analytics.model.dto.SimilarToken;
import com.token.sentiment.analytics.model.entity.TokenEntity;
import com.token.sentiment.analytics.repo.TokenRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SimilarTokenService {

    private final TokenRepository tokenRepository;

    /**
     * Every stored token whose symbol scores at least {@code minSimilarity}, best first.
     *
     * @param excludeTokenId optional token to leave out, typically the reference token itself
     */
    public List<SimilarToken> findSimilarTokens(String symbol, double minSimilarity, Long excludeTokenId) {
        if (!Guards.hasText(symbol)) throw new ValidationException("Must provide token_symbol");
        Guards.requireFraction("min_similarity", minSimilarity);

        List<TokenEntity> candidates = excludeTokenId == null
                ? tokenRepository.findAll()
                : tokenRepository.findByIdNot(excludeTokenId);

        List<SimilarToken> out = new ArrayList<>();
        for (TokenEntity t : candidates) {
            OptionalDouble s = SymbolSimilarity.score(symbol, t.getSymbol());
            if (s.isPresent() && s.getAsDouble() >= minSimilarity) {
                out.add(new SimilarToken(t.getId(), t.getSymbol(), t.getName(), t.getNetworkName(), s.getAsDouble()));
            }
        }
        out.sort(Comparator.comparingDouble(SimilarToken::similarity).reversed());
        log.debug("findSimilarTokens({}, {}): {} of {} token(s)", symbol, minSimilarity, out.size(), candidates.size());
        return out;
    }
}
