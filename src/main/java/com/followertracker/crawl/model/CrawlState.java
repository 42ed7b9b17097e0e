package com.followertracker.crawl.model;

public enum CrawlState {
    LISTING(-1),
    ENRICHING(-1),
    DONE(0),
    ABORTED(1),
    INTERRUPTED(2);

    private final int exitCode;

    CrawlState(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public boolean isTerminal() {
        return exitCode >= 0;
    }
}
