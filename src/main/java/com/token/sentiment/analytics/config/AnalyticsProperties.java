package com.token.sentiment.analytics.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Presentation caps applied to nested "top N" lists inside analytics results.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties("analytics")
public class AnalyticsProperties {

    /** Tokens listed per network in a network comparison. */
    @Positive(message = "analytics.network-comparison-top-tokens must be positive")
    private int networkComparisonTopTokens = 10;

    /** Symbols listed with a network timeline. */
    @Positive(message = "analytics.network-timeline-top-tokens must be positive")
    private int networkTimelineTopTokens = 5;

    /** Authors listed per network when one symbol is compared across networks. */
    @Positive(message = "analytics.cross-network-top-users must be positive")
    private int crossNetworkTopUsers = 5;
}
