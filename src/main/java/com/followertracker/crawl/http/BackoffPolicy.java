package com.followertracker.crawl.http;

import com.followertracker.config.CrawlerProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class BackoffPolicy {
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;

    public BackoffPolicy(int maxRetries, long baseDelayMs, long maxDelayMs) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
    }

    public static BackoffPolicy from(CrawlerProperties.Retry retry) {
        return new BackoffPolicy(retry.getMaxRetries(), retry.getBaseDelayMs(), retry.getMaxDelayMs());
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * @param failures consecutive transient failures so far, starting at 1
     */
    public boolean shouldRetry(int failures) {
        return failures <= maxRetries;
    }

    public Duration ceilingFor(int failures) {
        if (baseDelayMs <= 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(30, Math.max(0, failures - 1));
        long delay = baseDelayMs * (1L << shift);
        if (delay < 0) {
            delay = Long.MAX_VALUE;
        }
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return Duration.ofMillis(delay);
    }

    /**
     * Half of the ceiling plus up to another half of jitter.
     *
     * @param jitter sample in [0, 1)
     */
    public Duration delayFor(int failures, double jitter) {
        long ceiling = ceilingFor(failures).toMillis();
        if (ceiling <= 0) {
            return Duration.ZERO;
        }
        double safeJitter = Math.max(0.0, Math.min(jitter, 1.0));
        long half = ceiling / 2;
        long spread = ceiling - half;
        return Duration.ofMillis(half + (long) (spread * safeJitter));
    }

    public Duration delayFor(int failures) {
        return delayFor(failures, ThreadLocalRandom.current().nextDouble());
    }
}
