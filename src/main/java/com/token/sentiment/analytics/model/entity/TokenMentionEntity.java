package com.token.sentiment.analytics.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "token_mentions",
        indexes = {
                @Index(name = "ix_mentions_token", columnList = "token_id"),
                @Index(name = "ix_mentions_post", columnList = "post_id")
        })
public class TokenMentionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false)
    private PostEntity post;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "token_id", nullable = false)
    private TokenEntity token;

    /**
     * When the mention was recorded; may differ from the post's creation time
     */
    @Column
    private Instant mentionedAt;
}
