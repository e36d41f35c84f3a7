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
@Table(name = "posts",
        indexes = {
                @Index(name = "ux_posts_external_id", columnList = "externalId", unique = true),
                @Index(name = "ix_posts_created_at", columnList = "createdAt"),
                @Index(name = "ix_posts_author", columnList = "authorId")
        })
public class PostEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Identifier assigned by the social network
     */
    @Column(nullable = false, length = 64)
    private String externalId;

    @Column(nullable = false, length = 4000)
    private String content;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false, length = 64)
    private String authorId;

    @Column(length = 128)
    private String authorUsername;

    @Column(nullable = false)
    private int likeCount;

    @Column(nullable = false)
    private int reshareCount;

    @Column
    private Instant collectedAt;

    @OneToOne(mappedBy = "post", fetch = FetchType.LAZY)
    private SentimentLabelEntity sentimentLabel;
}
