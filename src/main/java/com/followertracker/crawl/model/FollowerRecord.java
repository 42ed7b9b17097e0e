package com.followertracker.crawl.model;

import java.time.Instant;

public record FollowerRecord(
    String followerId,
    long discoverySeq,
    FollowerStatus status,
    FollowerProfile profile,
    String failureReason,
    int profileAttempts,
    Instant discoveredAt,
    Instant lastFetchedAt
) {
}
