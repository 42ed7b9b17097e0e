package com.followertracker.crawl.model;

import java.time.Instant;

public record QuotaState(EndpointCategory category, int remaining, Instant resetAt) {
}
