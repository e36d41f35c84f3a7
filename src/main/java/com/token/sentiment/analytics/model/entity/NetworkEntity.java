package com.token.sentiment.analytics.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "networks",
        indexes = {
                @Index(name = "ux_networks_name", columnList = "name", unique = true)
        })
public class NetworkEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * e.g., "solana", "ethereum"
     */
    @Column(nullable = false, length = 64)
    private String name;

    @Column(length = 128)
    private String displayName;
}
