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
@Table(name = "tokens",
        indexes = {
                @Index(name = "ux_tokens_address", columnList = "address", unique = true),
                @Index(name = "ix_tokens_symbol", columnList = "symbol")
        })
public class TokenEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * On-chain address, unique across all networks
     */
    @Column(nullable = false, length = 128)
    private String address;

    /**
     * Ticker, e.g. "SOL". Not unique: the same symbol may exist on several networks.
     */
    @Column(nullable = false, length = 32)
    private String symbol;

    @Column(length = 128)
    private String name;

    @ManyToOne
    @JoinColumn(name = "network_id")
    private NetworkEntity network;

    @Column
    private Instant createdAt;

    /**
     * Network name or null when the token has no network affiliation.
     */
    public String getNetworkName() {
        return network == null ? null : network.getName();
    }
}
