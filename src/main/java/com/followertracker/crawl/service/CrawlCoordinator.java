package com.followertracker.crawl.service;

import com.followertracker.crawl.model.CrawlCheckpoint;
import com.followertracker.crawl.model.CrawlErrorKind;
import com.followertracker.crawl.model.CrawlOutcome;
import com.followertracker.crawl.model.CrawlState;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerStatus;
import com.followertracker.crawl.persistence.FollowerJdbcRepository;
import com.followertracker.crawl.persistence.StoreAccountMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Drives one resumable crawl: lists every follower page, then enriches every discovered
 * follower, persisting progress after each unit of work so a restarted run continues where
 * the last one stopped.
 */
@Service
public class CrawlCoordinator {
    private static final Logger log = LoggerFactory.getLogger(CrawlCoordinator.class);

    private final FollowerJdbcRepository repository;
    private final StoreLeaseService leaseService;
    private final PageFetcher pageFetcher;
    private final ProfileEnricher profileEnricher;

    public CrawlCoordinator(
        FollowerJdbcRepository repository,
        StoreLeaseService leaseService,
        PageFetcher pageFetcher,
        ProfileEnricher profileEnricher
    ) {
        this.repository = repository;
        this.leaseService = leaseService;
        this.pageFetcher = pageFetcher;
        this.profileEnricher = profileEnricher;
    }

    public CrawlOutcome run(CrawlRequest request) {
        Instant startedAt = Instant.now();
        RunContext context = new RunContext(request);
        try (StoreLeaseService.Lease lease = leaseService.acquire()) {
            context.checkpoint = repository.bindAccount(request.account());
            CrawlState state = resumeState(context.checkpoint);
            log.info(
                "Crawl of {} starting in {} (cursor={}, pagesFetched={})",
                context.checkpoint.account(),
                state,
                context.checkpoint.listingCursor(),
                context.checkpoint.pagesFetched()
            );
            while (!state.isTerminal()) {
                if (stopRequested(context)) {
                    state = CrawlState.INTERRUPTED;
                    context.fail(CrawlErrorKind.INTERRUPTED, context.interrupted ? "interrupted" : "exit marker found");
                    break;
                }
                lease.ensureHeld();
                state = state == CrawlState.LISTING ? listNextPage(context) : enrichNextBatch(context);
            }
            context.state = state;
        } catch (InterruptedException e) {
            context.interrupted = true;
            context.abort(CrawlState.INTERRUPTED, CrawlErrorKind.INTERRUPTED, "interrupted");
        } catch (StoreLeaseException e) {
            context.abort(CrawlState.ABORTED, CrawlErrorKind.LEASE, e.getMessage());
        } catch (StoreAccountMismatchException e) {
            log.error("Store is bound to {}, refusing to crawl {}", e.storedAccount(), e.requestedAccount());
            context.abort(CrawlState.ABORTED, CrawlErrorKind.ACCOUNT_MISMATCH, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Storage failure during crawl of {}", request.account(), e);
            context.abort(CrawlState.ABORTED, CrawlErrorKind.STORAGE, e.getMostSpecificCause().getMessage());
        }
        // Restored only after the lease is released so that release is not cut short.
        if (context.interrupted) {
            Thread.currentThread().interrupt();
        }

        CrawlOutcome outcome = context.toOutcome(Duration.between(startedAt, Instant.now()));
        if (outcome.state() == CrawlState.DONE) {
            log.info(
                "Crawl of {} done: pages={}, newFollowers={}, profilesFetched={}, profilesFailed={}, elapsed={}s",
                outcome.account(),
                outcome.pagesFetched(),
                outcome.newFollowers(),
                outcome.profilesFetched(),
                outcome.profilesFailed(),
                outcome.elapsed().toSeconds()
            );
        } else {
            log.warn(
                "Crawl of {} ended {} ({}: {}); progress is saved and a rerun resumes from cursor {}",
                outcome.account(),
                outcome.state(),
                outcome.errorKind(),
                outcome.errorMessage(),
                outcome.lastCheckpoint() == null ? null : outcome.lastCheckpoint().listingCursor()
            );
        }
        return outcome;
    }

    private CrawlState resumeState(CrawlCheckpoint checkpoint) {
        if (!checkpoint.isListingComplete()) {
            return CrawlState.LISTING;
        }
        return repository.hasIdentifiersNeedingProfile() ? CrawlState.ENRICHING : CrawlState.DONE;
    }

    private CrawlState listNextPage(RunContext context) throws InterruptedException {
        String cursor = context.checkpoint.listingCursor();
        FetchResult<FollowerPage> result = pageFetcher.fetchFollowerPage(
            context.request.credentials(),
            context.checkpoint.account(),
            cursor
        );
        if (result instanceof FetchResult.Ok<FollowerPage> ok) {
            FollowerPage page = ok.value();
            boolean last = page.done() || page.nextCursor() == null || page.nextCursor().isBlank();
            if (!last && page.nextCursor().equals(cursor)) {
                return context.abort(CrawlState.ABORTED, CrawlErrorKind.FATAL_API,
                    "listing cursor did not advance past " + cursor);
            }
            int added = repository.upsertFollowers(page.identifiers());
            String nextCursor = last ? CrawlCheckpoint.LISTING_COMPLETE : page.nextCursor();
            context.checkpoint = repository.saveCheckpoint(
                context.checkpoint.withListingCursor(nextCursor, context.checkpoint.pagesFetched() + 1)
            );
            context.pagesFetched++;
            context.newFollowers += added;
            log.info("Stored follower page {} ({} ids, {} new); next cursor {}",
                context.checkpoint.pagesFetched(), page.identifiers().size(), added, nextCursor);
            return last ? resumeState(context.checkpoint) : CrawlState.LISTING;
        }
        if (result instanceof FetchResult.TransientError<FollowerPage> error) {
            return context.abort(CrawlState.ABORTED, CrawlErrorKind.FATAL_API,
                error.reasonCode() + " listing followers at cursor " + cursor + " (" + error.message() + ")");
        }
        if (result instanceof FetchResult.NotFound<FollowerPage> notFound) {
            return context.abort(CrawlState.ABORTED, CrawlErrorKind.FATAL_API,
                notFound.reasonCode() + " listing followers of " + context.checkpoint.account());
        }
        if (result instanceof FetchResult.FatalError<FollowerPage> fatal) {
            return context.abort(CrawlState.ABORTED, CrawlErrorKind.FATAL_API,
                fatal.reasonCode() + ": " + fatal.message());
        }
        throw new IllegalStateException("Unexpected fetch result " + result);
    }

    private CrawlState enrichNextBatch(RunContext context) throws InterruptedException {
        List<String> batch = repository.nextIdentifiersNeedingProfile(profileEnricher.batchSize());
        if (batch.isEmpty()) {
            return CrawlState.DONE;
        }
        ProfileEnricher.BatchResult result = profileEnricher.enrich(
            batch,
            context.request.credentials(),
            () -> Thread.currentThread().isInterrupted() || exitMarkerPresent(context.request)
        );
        context.profilesFetched += result.fetched();
        context.profilesFailed += result.failed();

        Map<FollowerStatus, Long> counts = repository.countByStatus();
        long terminal = counts.entrySet().stream()
            .filter(entry -> entry.getKey().isTerminal())
            .mapToLong(Map.Entry::getValue)
            .sum();
        context.checkpoint = repository.saveCheckpoint(context.checkpoint.withEnrichmentMarker(terminal));

        if (result.aborted()) {
            return context.abort(CrawlState.ABORTED, CrawlErrorKind.FATAL_API,
                result.fatalReason() + ": " + result.fatalMessage());
        }
        if (result.interrupted() || Thread.interrupted()) {
            throw new InterruptedException("Enrichment interrupted");
        }
        return counts.getOrDefault(FollowerStatus.DISCOVERED, 0L) > 0 ? CrawlState.ENRICHING : CrawlState.DONE;
    }

    private boolean stopRequested(RunContext context) {
        if (Thread.interrupted()) {
            context.interrupted = true;
            return true;
        }
        if (exitMarkerPresent(context.request)) {
            log.info("Exit marker {} found; stopping", context.request.exitMarker());
            return true;
        }
        return false;
    }

    private static boolean exitMarkerPresent(CrawlRequest request) {
        return request.exitMarker() != null && Files.exists(request.exitMarker());
    }

    private static final class RunContext {
        private final CrawlRequest request;
        private CrawlCheckpoint checkpoint;
        private CrawlState state;
        private boolean interrupted;
        private CrawlErrorKind errorKind;
        private String errorMessage;
        private long pagesFetched;
        private long newFollowers;
        private long profilesFetched;
        private long profilesFailed;

        private RunContext(CrawlRequest request) {
            this.request = request;
        }

        private void fail(CrawlErrorKind kind, String message) {
            if (errorKind == null) {
                errorKind = kind;
                errorMessage = message;
            }
        }

        private CrawlState abort(CrawlState terminal, CrawlErrorKind kind, String message) {
            fail(kind, message);
            state = terminal;
            return terminal;
        }

        private CrawlOutcome toOutcome(Duration elapsed) {
            String account = checkpoint == null ? request.account() : checkpoint.account();
            return new CrawlOutcome(
                account,
                state == null ? CrawlState.ABORTED : state,
                pagesFetched,
                newFollowers,
                profilesFetched,
                profilesFailed,
                errorKind,
                errorMessage,
                checkpoint,
                elapsed
            );
        }
    }
}
