package com.followertracker.crawl.model;

import java.time.Instant;

public record StoreLease(String lockOwner, Instant lockedUntil, Instant acquiredAt) {
}
