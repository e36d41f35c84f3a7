package com.token.sentiment.analytics.repo;

import com.token.sentiment.analytics.dto.UserActivityRow;
import com.token.sentiment.analytics.model.entity.PostEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface PostRepository extends JpaRepository<PostEntity, Long> {

    /**
     * Authors of posts mentioning the tokens, by mention count then likes.
     */
    @Query("""
            SELECT new com.token.sentiment.analytics.dto.UserActivityRow(p.authorId, p.authorUsername,
                   COUNT(p), SUM(p.likeCount), SUM(p.reshareCount))
            FROM TokenMentionEntity m JOIN m.post p
            WHERE m.token.id IN :tokenIds
              AND p.createdAt >= :start AND p.createdAt < :end
            GROUP BY p.authorId, p.authorUsername
            ORDER BY COUNT(p) DESC, SUM(p.likeCount) DESC, p.authorId
            """)
    List<UserActivityRow> findTopAuthors(@Param("tokenIds") Collection<Long> tokenIds,
                                         @Param("start") Instant start,
                                         @Param("end") Instant end,
                                         Pageable pageable);
}
