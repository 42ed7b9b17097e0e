package com.followertracker.crawl.http;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.model.EndpointCategory;
import com.followertracker.crawl.model.QuotaDecision;
import com.followertracker.crawl.model.QuotaObservation;
import com.followertracker.crawl.model.QuotaState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-endpoint rate-limit budget. Starts pessimistic (nothing remaining, window already
 * reset) so the first call of each category goes out unthrottled and the API's own report
 * seeds the real budget.
 */
public class QuotaTracker {
    private final Clock clock;
    private final Duration window;
    private final Duration resetSlack;
    private final Map<EndpointCategory, Integer> windowLimits = new EnumMap<>(EndpointCategory.class);
    private final Map<EndpointCategory, QuotaState> states = new EnumMap<>(EndpointCategory.class);

    public QuotaTracker(Clock clock, CrawlerProperties.Quota quota) {
        this.clock = clock;
        this.window = Duration.ofMinutes(quota.getWindowMinutes());
        this.resetSlack = Duration.ofSeconds(quota.getResetSlackSeconds());
        windowLimits.put(EndpointCategory.FOLLOWER_IDS, quota.getFollowerIdsLimit());
        windowLimits.put(EndpointCategory.USER_SHOW, quota.getUserShowLimit());
    }

    public synchronized QuotaDecision reserve(EndpointCategory category) {
        Instant now = clock.instant();
        QuotaState state = stateFor(category);
        if (state.remaining() > 0) {
            states.put(category, new QuotaState(category, state.remaining() - 1, state.resetAt()));
            return QuotaDecision.ok();
        }
        Instant availableAt = state.resetAt().plus(resetSlack);
        if (!now.isBefore(availableAt)) {
            // Window rolled over without a fresh report; assume the documented limit until the API says otherwise.
            int limit = windowLimits.getOrDefault(category, 1);
            states.put(category, new QuotaState(category, limit - 1, now.plus(window)));
            return QuotaDecision.ok();
        }
        return QuotaDecision.waitFor(Duration.between(now, availableAt));
    }

    public synchronized void observe(EndpointCategory category, int remaining, Instant resetAt) {
        Instant safeReset = resetAt;
        if (safeReset == null) {
            QuotaState existing = states.get(category);
            safeReset = existing == null ? clock.instant().plus(window) : existing.resetAt();
        }
        states.put(category, new QuotaState(category, Math.max(0, remaining), safeReset));
    }

    public void observe(EndpointCategory category, QuotaObservation observation) {
        if (observation == null) {
            return;
        }
        observe(category, observation.remaining(), observation.resetAt());
    }

    /**
     * Records a rate-limit rejection. Uses the reported reset when there is one, otherwise
     * blocks the category for a full window.
     */
    public synchronized void markExhausted(EndpointCategory category, QuotaObservation observation) {
        Instant now = clock.instant();
        Instant resetAt = observation == null ? null : observation.resetAt();
        if (resetAt == null || !resetAt.isAfter(now)) {
            QuotaState existing = states.get(category);
            resetAt = existing != null && existing.resetAt().isAfter(now) ? existing.resetAt() : now.plus(window);
        }
        states.put(category, new QuotaState(category, 0, resetAt));
    }

    public synchronized QuotaState snapshot(EndpointCategory category) {
        return stateFor(category);
    }

    private QuotaState stateFor(EndpointCategory category) {
        return states.computeIfAbsent(category, key -> new QuotaState(key, 0, Instant.EPOCH));
    }
}
