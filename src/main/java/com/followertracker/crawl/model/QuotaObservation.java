package com.followertracker.crawl.model;

import java.time.Instant;

public record QuotaObservation(int remaining, Instant resetAt) {
    public QuotaObservation {
        remaining = Math.max(0, remaining);
    }
}
