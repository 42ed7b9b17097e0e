package com.followertracker.crawl.model;

import java.time.Duration;

public record CrawlOutcome(
    String account,
    CrawlState state,
    long pagesFetched,
    long newFollowers,
    long profilesFetched,
    long profilesFailed,
    CrawlErrorKind errorKind,
    String errorMessage,
    CrawlCheckpoint lastCheckpoint,
    Duration elapsed
) {
    public int exitCode() {
        return state.exitCode();
    }
}
