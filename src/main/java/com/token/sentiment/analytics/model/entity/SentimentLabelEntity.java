package com.token.sentiment.analytics.model.entity;

import com.token.sentiment.analytics.enums.Sentiment;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "sentiment_labels")
public class SentimentLabelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * At most one label per post
     */
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id", nullable = false, unique = true)
    private PostEntity post;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Sentiment sentiment;

    /**
     * 0..1
     */
    @Column(nullable = false)
    private double confidence;

    @Column
    private Instant analyzedAt;
}
