package com.token.sentiment.analytics.dto;

public record UserActivityRow(String authorId, String username, Long postCount, Long totalLikes, Long totalReshares) {

    public long likes() {
        return totalLikes == null ? 0L : totalLikes;
    }

    public long reshares() {
        return totalReshares == null ? 0L : totalReshares;
    }
}
