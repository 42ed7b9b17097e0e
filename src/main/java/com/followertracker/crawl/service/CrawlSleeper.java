package com.followertracker.crawl.service;

import java.time.Duration;

@FunctionalInterface
public interface CrawlSleeper {

    void sleep(Duration duration) throws InterruptedException;

    static CrawlSleeper threadSleeper() {
        return duration -> {
            long millis = duration == null ? 0 : duration.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
