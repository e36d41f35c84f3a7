package com.token.sentiment.analytics.model.dto;

import java.util.List;

public record TopUsers(String token, String network, String period, List<UserActivity> users) {
}
