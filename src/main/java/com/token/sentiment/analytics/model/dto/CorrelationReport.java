package com.token.sentiment.analytics.model.dto;

import java.util.List;

public record CorrelationReport(PrimaryToken primaryToken, String period, List<CorrelatedToken> correlatedTokens) {
}
