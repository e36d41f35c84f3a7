package com.token.sentiment.analytics.repo;

import com.token.sentiment.analytics.dto.NetworkSentimentRow;
import com.token.sentiment.analytics.dto.SentimentCountRow;
import com.token.sentiment.analytics.dto.SentimentPointRow;
import com.token.sentiment.analytics.dto.TokenNetworkSentimentRow;
import com.token.sentiment.analytics.model.entity.SentimentLabelEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Sentiment aggregations. Unless stated otherwise, one row is counted per mention
 * (post x matched token), and windows filter on the post's creation time, {@code [start, end)}.
 */
@Repository
public interface SentimentLabelRepository extends JpaRepository<SentimentLabelEntity, Long> {

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentCountRow(s.sentiment, COUNT(m), AVG(s.confidence))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s
            WHERE m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY s.sentiment
            """)
    List<SentimentCountRow> countByTokens(@Param("tokenIds") Collection<Long> tokenIds,
                                          @Param("start") Instant start,
                                          @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentCountRow(s.sentiment, COUNT(m), AVG(s.confidence))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s
            WHERE m.token.id = :tokenId
            GROUP BY s.sentiment
            """)
    List<SentimentCountRow> countByTokenAllTime(@Param("tokenId") Long tokenId);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentCountRow(s.sentiment, COUNT(m), AVG(s.confidence))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE n.name = :network
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY s.sentiment
            """)
    List<SentimentCountRow> countByNetwork(@Param("network") String network,
                                           @Param("start") Instant start,
                                           @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentCountRow(s.sentiment, COUNT(m), AVG(s.confidence))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s
            WHERE p.authorId = :authorId
              AND m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY s.sentiment
            """)
    List<SentimentCountRow> countByAuthorAndTokens(@Param("authorId") String authorId,
                                                   @Param("tokenIds") Collection<Long> tokenIds,
                                                   @Param("start") Instant start,
                                                   @Param("end") Instant end);

    /**
     * Sentiment of the posts mentioning one of {@code primaryIds} and also {@code tokenId}; one row per post.
     */
    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentCountRow(s.sentiment, COUNT(s), AVG(s.confidence))
            FROM SentimentLabelEntity s JOIN s.post p
            WHERE p.createdAt >= :start AND p.createdAt < :end
              AND p.id IN (SELECT a.post.id FROM TokenMentionEntity a WHERE a.token.id IN :primaryIds)
              AND p.id IN (SELECT b.post.id FROM TokenMentionEntity b WHERE b.token.id = :tokenId)
            GROUP BY s.sentiment
            """)
    List<SentimentCountRow> countCombined(@Param("primaryIds") Collection<Long> primaryIds,
                                          @Param("tokenId") Long tokenId,
                                          @Param("start") Instant start,
                                          @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentPointRow(p.createdAt, s.sentiment)
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s
            WHERE m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            """)
    List<SentimentPointRow> findPointsByTokens(@Param("tokenIds") Collection<Long> tokenIds,
                                               @Param("start") Instant start,
                                               @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentPointRow(p.createdAt, s.sentiment)
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE n.name = :network
              AND p.createdAt >= :start AND p.createdAt < :end
            """)
    List<SentimentPointRow> findPointsByNetwork(@Param("network") String network,
                                                @Param("start") Instant start,
                                                @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentPointRow(p.createdAt, s.sentiment)
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s
            WHERE p.createdAt >= :start AND p.createdAt < :end
            """)
    List<SentimentPointRow> findPoints(@Param("start") Instant start,
                                       @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.SentimentPointRow(p.createdAt, s.sentiment)
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE n.name IN :networks
              AND p.createdAt >= :start AND p.createdAt < :end
            """)
    List<SentimentPointRow> findPointsInNetworks(@Param("networks") Collection<String> networks,
                                                 @Param("start") Instant start,
                                                 @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.NetworkSentimentRow(n.name, s.sentiment, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE p.createdAt >= :start AND p.createdAt < :end
            GROUP BY n.name, s.sentiment
            """)
    List<NetworkSentimentRow> countGroupedByNetwork(@Param("start") Instant start,
                                                    @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.NetworkSentimentRow(n.name, s.sentiment, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE n.name IN :networks
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY n.name, s.sentiment
            """)
    List<NetworkSentimentRow> countGroupedByNetworkIn(@Param("networks") Collection<String> networks,
                                                      @Param("start") Instant start,
                                                      @Param("end") Instant end);

    @Query("""
            SELECT new com.token.sentiment.analytics.dto.TokenNetworkSentimentRow(t.symbol, n.name, s.sentiment, COUNT(m))
            FROM TokenMentionEntity m JOIN m.post p JOIN p.sentimentLabel s JOIN m.token t JOIN t.network n
            WHERE t.symbol IN :symbols AND n.name IN :networks
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY t.symbol, n.name, s.sentiment
            """)
    List<TokenNetworkSentimentRow> countGroupedBySymbolAndNetwork(@Param("symbols") Collection<String> symbols,
                                                                  @Param("networks") Collection<String> networks,
                                                                  @Param("start") Instant start,
                                                                  @Param("end") Instant end);
}
