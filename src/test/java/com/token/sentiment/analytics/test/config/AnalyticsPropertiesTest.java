package com.token.sentiment.analytics.test.config;

import com.token.sentiment.analytics.config.AnalyticsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class AnalyticsPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(AnalyticsProperties.class)
    static class PropertiesConfig {
    }

    final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaultsAndOverridesBind() {
        runner.withPropertyValues("analytics.cross-network-top-users=3").run(ctx -> {
            AnalyticsProperties p = ctx.getBean(AnalyticsProperties.class);
            assertThat(p.getNetworkComparisonTopTokens()).isEqualTo(10);
            assertThat(p.getNetworkTimelineTopTokens()).isEqualTo(5);
            assertThat(p.getCrossNetworkTopUsers()).isEqualTo(3);
        });
    }

    @Test
    void nonPositiveCapFailsStartup() {
        runner.withPropertyValues("analytics.network-timeline-top-tokens=0").run(ctx -> {
            assertThat(ctx).hasFailed();
            assertThat(ctx.getStartupFailure())
                    .rootCause().hasMessageContaining("analytics.network-timeline-top-tokens must be positive");
        });
    }
}
