package com.followertracker.crawl.model;

public enum CrawlErrorKind {
    FATAL_API,
    STORAGE,
    LEASE,
    ACCOUNT_MISMATCH,
    CREDENTIALS,
    INTERRUPTED
}
