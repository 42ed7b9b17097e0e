package com.followertracker.crawl.service;

import com.followertracker.crawl.http.ApiCredentials;
import com.followertracker.crawl.http.BackoffPolicy;
import com.followertracker.crawl.http.FollowerApiClient;
import com.followertracker.crawl.http.QuotaTracker;
import com.followertracker.crawl.model.EndpointCategory;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerProfile;
import com.followertracker.crawl.model.QuotaDecision;
import com.followertracker.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Quota-aware access to the API: every attempt first reserves budget from the
 * {@link QuotaTracker}, sleeping until the reset when the budget is spent. Rate-limit
 * rejections are waited out; transient failures are retried with backoff until the policy
 * gives up, at which point a {@code RETRIES_EXHAUSTED} transient error is returned for the
 * caller to escalate or record.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final FollowerApiClient apiClient;
    private final QuotaTracker quotaTracker;
    private final BackoffPolicy backoffPolicy;
    private final CrawlSleeper sleeper;

    public PageFetcher(
        FollowerApiClient apiClient,
        QuotaTracker quotaTracker,
        BackoffPolicy backoffPolicy,
        CrawlSleeper sleeper
    ) {
        this.apiClient = apiClient;
        this.quotaTracker = quotaTracker;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
    }

    public FetchResult<FollowerPage> fetchFollowerPage(ApiCredentials credentials, String account, String cursor)
        throws InterruptedException {
        return callWithRetries(
            EndpointCategory.FOLLOWER_IDS,
            "cursor " + (cursor == null ? "<first>" : cursor),
            () -> apiClient.fetchFollowerPage(credentials, account, cursor)
        );
    }

    public FetchResult<FollowerProfile> fetchProfile(ApiCredentials credentials, String followerId)
        throws InterruptedException {
        return callWithRetries(
            EndpointCategory.USER_SHOW,
            "follower " + followerId,
            () -> apiClient.fetchProfile(credentials, followerId)
        );
    }

    private <T> FetchResult<T> callWithRetries(
        EndpointCategory category,
        String target,
        Supplier<FetchResult<T>> call
    ) throws InterruptedException {
        int failures = 0;
        while (true) {
            awaitQuota(category);
            FetchResult<T> result = call.get();
            if (result instanceof FetchResult.RateLimited<T> limited) {
                quotaTracker.markExhausted(category, limited.quota());
                log.info("Rate limited on {} for {}; will retry after reset", category, target);
                continue;
            }
            quotaTracker.observe(category, result.quota());
            if (result instanceof FetchResult.TransientError<T> error) {
                if (Thread.interrupted() || ReasonCodeClassifier.INTERRUPTED.equals(error.reasonCode())) {
                    throw new InterruptedException("Interrupted while fetching " + target);
                }
                failures++;
                if (!backoffPolicy.shouldRetry(failures)) {
                    log.warn("Giving up on {} for {} after {} transient failures (last {})",
                        category, target, failures, error.reasonCode());
                    return FetchResult.transientError(
                        ReasonCodeClassifier.RETRIES_EXHAUSTED,
                        "last failure " + error.reasonCode() + ": " + error.message(),
                        error.quota()
                    );
                }
                Duration delay = backoffPolicy.delayFor(failures);
                log.warn("Transient {} on {} for {}; retry {} of {} in {} ms",
                    error.reasonCode(), category, target, failures, backoffPolicy.maxRetries(), delay.toMillis());
                sleeper.sleep(delay);
                continue;
            }
            return result;
        }
    }

    private void awaitQuota(EndpointCategory category) throws InterruptedException {
        while (true) {
            QuotaDecision decision = quotaTracker.reserve(category);
            if (decision.granted()) {
                return;
            }
            log.info("Quota for {} spent; sleeping {} seconds until reset", category, decision.waitTime().toSeconds());
            sleeper.sleep(decision.waitTime());
        }
    }
}
