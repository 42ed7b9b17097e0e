package com.followertracker.crawl.model;

import java.time.Duration;

public record QuotaDecision(boolean granted, Duration waitTime) {
    private static final QuotaDecision OK = new QuotaDecision(true, Duration.ZERO);

    public static QuotaDecision ok() {
        return OK;
    }

    public static QuotaDecision waitFor(Duration waitTime) {
        Duration safe = waitTime == null || waitTime.isNegative() ? Duration.ZERO : waitTime;
        return new QuotaDecision(false, safe);
    }
}
