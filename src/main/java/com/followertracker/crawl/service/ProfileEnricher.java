package com.followertracker.crawl.service;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.http.ApiCredentials;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerProfile;
import com.followertracker.crawl.model.ProfileResult;
import com.followertracker.crawl.persistence.FollowerJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

/**
 * Fetches profiles for one batch of discovered identifiers on the enrichment worker pool.
 * Each identifier in the batch is handled by exactly one task; every result is committed
 * before the task returns.
 */
@Service
public class ProfileEnricher {
    private static final Logger log = LoggerFactory.getLogger(ProfileEnricher.class);

    private final FollowerJdbcRepository repository;
    private final PageFetcher pageFetcher;
    private final ExecutorService enrichmentExecutor;
    private final CrawlerProperties properties;

    public ProfileEnricher(
        FollowerJdbcRepository repository,
        PageFetcher pageFetcher,
        @Qualifier("enrichmentExecutor") ExecutorService enrichmentExecutor,
        CrawlerProperties properties
    ) {
        this.repository = repository;
        this.pageFetcher = pageFetcher;
        this.enrichmentExecutor = enrichmentExecutor;
        this.properties = properties;
    }

    public int batchSize() {
        return properties.getEnrichment().getBatchSize();
    }

    /**
     * @param stopRequested checked before each identifier; once true, remaining identifiers
     *                      stay discovered for the next run
     */
    public BatchResult enrich(List<String> followerIds, ApiCredentials credentials, BooleanSupplier stopRequested)
        throws InterruptedException {
        AtomicReference<FetchResult.FatalError<FollowerProfile>> fatal = new AtomicReference<>();
        List<Callable<ItemOutcome>> tasks = new ArrayList<>(followerIds.size());
        for (String followerId : followerIds) {
            tasks.add(() -> enrichOne(followerId, credentials, stopRequested, fatal));
        }

        // invokeAll cancels unfinished tasks if this thread is interrupted
        List<Future<ItemOutcome>> futures = enrichmentExecutor.invokeAll(tasks);

        int fetched = 0;
        int failed = 0;
        int skipped = 0;
        boolean interrupted = false;
        RuntimeException storageFailure = null;
        for (Future<ItemOutcome> future : futures) {
            try {
                switch (future.get()) {
                    case FETCHED -> fetched++;
                    case FAILED -> failed++;
                    case INTERRUPTED -> {
                        interrupted = true;
                        skipped++;
                    }
                    default -> skipped++;
                }
            } catch (CancellationException e) {
                interrupted = true;
                skipped++;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    if (storageFailure == null) {
                        storageFailure = runtime;
                    } else {
                        storageFailure.addSuppressed(runtime);
                    }
                } else {
                    throw new IllegalStateException("Profile task failed", cause);
                }
            }
        }
        if (storageFailure != null) {
            throw storageFailure;
        }
        FetchResult.FatalError<FollowerProfile> fatalError = fatal.get();
        log.info("Enriched batch of {}: fetched={}, failed={}, skipped={}",
            followerIds.size(), fetched, failed, skipped);
        return new BatchResult(
            fetched,
            failed,
            interrupted,
            fatalError == null ? null : fatalError.reasonCode(),
            fatalError == null ? null : fatalError.message()
        );
    }

    private ItemOutcome enrichOne(
        String followerId,
        ApiCredentials credentials,
        BooleanSupplier stopRequested,
        AtomicReference<FetchResult.FatalError<FollowerProfile>> fatal
    ) {
        if (fatal.get() != null || stopRequested.getAsBoolean()) {
            return ItemOutcome.SKIPPED;
        }
        FetchResult<FollowerProfile> result;
        try {
            result = pageFetcher.fetchProfile(credentials, followerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ItemOutcome.INTERRUPTED;
        }

        if (result instanceof FetchResult.Ok<FollowerProfile> ok) {
            repository.recordProfile(followerId, ProfileResult.fetched(ok.value()));
            return ItemOutcome.FETCHED;
        }
        if (result instanceof FetchResult.NotFound<FollowerProfile> notFound) {
            log.info("Follower {} unavailable ({})", followerId, notFound.reasonCode());
            repository.recordProfile(followerId, ProfileResult.failed(notFound.reasonCode()));
            return ItemOutcome.FAILED;
        }
        if (result instanceof FetchResult.TransientError<FollowerProfile> error) {
            repository.recordProfile(followerId, ProfileResult.failed(error.reasonCode()));
            return ItemOutcome.FAILED;
        }
        if (result instanceof FetchResult.FatalError<FollowerProfile> error) {
            if (fatal.compareAndSet(null, error)) {
                log.error("Fatal API error while enriching {}: {} {}", followerId, error.reasonCode(), error.message());
            }
            return ItemOutcome.SKIPPED;
        }
        throw new IllegalStateException("Unexpected fetch result " + result);
    }

    private enum ItemOutcome {
        FETCHED,
        FAILED,
        SKIPPED,
        INTERRUPTED
    }

    public record BatchResult(
        int fetched,
        int failed,
        boolean interrupted,
        String fatalReason,
        String fatalMessage
    ) {
        public boolean aborted() {
            return fatalReason != null;
        }
    }
}
