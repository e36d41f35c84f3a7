package com.token.sentiment.analytics.repo;

import com.token.sentiment.analytics.dto.NamedCountRow;
import com.token.sentiment.analytics.dto.TokenMentionCountRow;
import com.token.sentiment.analytics.dto.TokenPairCountRow;
import com.token.sentiment.analytics.model.entity.TokenMentionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Mention volume queries. Windows filter on the post's creation time, {@code [start, end)}.
 */
@Repository
public interface TokenMentionRepository extends JpaRepository<TokenMentionEntity, Long> {

    @Query("""
            SELECT COUNT(m) FROM TokenMentionEntity m JOIN m.post p
            WHERE m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            """)
    long countMentions(@Param("tokenIds") Collection<Long> tokenIds,
                       @Param("start") Instant start,
                       @Param("end") Instant end);

    long countByToken_Id(Long tokenId);

    @Query("SELECT MIN(m.mentionedAt) FROM TokenMentionEntity m WHERE m.token.id = :tokenId")
    Instant findFirstMentionedAt(@Param("tokenId") Long tokenId);

    @Query("SELECT MAX(m.mentionedAt) FROM TokenMentionEntity m WHERE m.token.id = :tokenId")
    Instant findLastMentionedAt(@Param("tokenId") Long tokenId);

    /**
     * Post creation time of every mention, oldest first.
     */
    @Query("""
            SELECT p.createdAt FROM TokenMentionEntity m JOIN m.post p
            WHERE m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            ORDER BY p.createdAt
            """)
    List<Instant> findMentionTimes(@Param("tokenIds") Collection<Long> tokenIds,
                                   @Param("start") Instant start,
                                   @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenMentionCountRow(t.id, t.symbol, t.name, n.name, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t LEFT JOIN t.network n
            WHERE p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.id, t.symbol, t.name, n.name
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, SUM(p.likeCount) DESC, t.id
            """)
    List<TokenMentionCountRow> countTokenMentions(@Param("start") Instant start,
                                                  @Param("end") Instant end,
                                                  @Param("minMentions") long minMentions,
                                                  Pageable pageable);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenMentionCountRow(t.id, t.symbol, t.name, n.name, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t JOIN t.network n
            WHERE n.name = :network
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.id, t.symbol, t.name, n.name
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, SUM(p.likeCount) DESC, t.id
            """)
    List<TokenMentionCountRow> countTokenMentionsOnNetwork(@Param("network") String network,
                                                           @Param("start") Instant start,
                                                           @Param("end") Instant end,
                                                           @Param("minMentions") long minMentions,
                                                           Pageable pageable);

    /**
     * Mentions per (symbol, network); tokens without a network come back with a null network.
     */
    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenPairCountRow(t.symbol, n.name, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t LEFT JOIN t.network n
            WHERE p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.symbol, n.name
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, t.symbol
            """)
    List<TokenPairCountRow> countTokenPairs(@Param("start") Instant start,
                                            @Param("end") Instant end,
                                            @Param("minMentions") long minMentions,
                                            Pageable pageable);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenPairCountRow(t.symbol, n.name, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t JOIN t.network n
            WHERE n.name IN :networks
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.symbol, n.name
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, t.symbol
            """)
    List<TokenPairCountRow> countTokenPairsInNetworks(@Param("networks") Collection<String> networks,
                                                      @Param("start") Instant start,
                                                      @Param("end") Instant end,
                                                      @Param("minMentions") long minMentions,
                                                      Pageable pageable);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.NamedCountRow(n.name, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t JOIN t.network n
            WHERE p.createdAt >= :start AND p.createdAt < :end
            GROUP BY n.name
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, n.name
            """)
    List<NamedCountRow> countMentionsByNetwork(@Param("start") Instant start,
                                               @Param("end") Instant end,
                                               @Param("minMentions") long minMentions,
                                               Pageable pageable);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.NamedCountRow(t.symbol, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t JOIN t.network n
            WHERE n.name IN :networks
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.symbol
            HAVING COUNT(m) >= :minMentions
            ORDER BY COUNT(m) DESC, t.symbol
            """)
    List<NamedCountRow> countSymbolMentionsInNetworks(@Param("networks") Collection<String> networks,
                                                      @Param("start") Instant start,
                                                      @Param("end") Instant end,
                                                      @Param("minMentions") long minMentions,
                                                      Pageable pageable);

    /**
     * Tokens appearing in the same posts as any of {@code primaryIds}, counted once per post.
     */
    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenMentionCountRow(t.id, t.symbol, t.name, n.name, COUNT(DISTINCT p.id))
            FROM TokenMentionEntity m JOIN m.post p JOIN m.token t LEFT JOIN t.network n
            WHERE t.id NOT IN :primaryIds
              AND p.createdAt >= :start AND p.createdAt < :end
              AND p.id IN (SELECT pm.post.id FROM TokenMentionEntity pm WHERE pm.token.id IN :primaryIds)
            GROUP BY t.id, t.symbol, t.name, n.name
            HAVING COUNT(DISTINCT p.id) >= :minCoMentions
            ORDER BY COUNT(DISTINCT p.id) DESC, t.id
            """)
    List<TokenMentionCountRow> findCoMentionedTokens(@Param("primaryIds") Collection<Long> primaryIds,
                                                     @Param("start") Instant start,
                                                     @Param("end") Instant end,
                                                     @Param("minCoMentions") long minCoMentions,
                                                     Pageable pageable);
}
