package com.followertracker.crawl.model;

import java.time.Instant;

public record FollowerProfile(
    String followerId,
    String screenName,
    String displayName,
    String bio,
    String location,
    String url,
    long followersCount,
    long friendsCount,
    long statusesCount,
    long listedCount,
    long favouritesCount,
    boolean verified,
    boolean protectedAccount,
    Instant accountCreatedAt,
    String lang,
    String lastStatusId,
    String lastStatusText,
    Instant lastStatusAt
) {
}
