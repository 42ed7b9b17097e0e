package com.followertracker.crawl.service;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.MutableClock;
import com.followertracker.crawl.http.ApiCredentials;
import com.followertracker.crawl.http.BackoffPolicy;
import com.followertracker.crawl.http.QuotaTracker;
import com.followertracker.crawl.model.CrawlCheckpoint;
import com.followertracker.crawl.model.CrawlErrorKind;
import com.followertracker.crawl.model.CrawlOutcome;
import com.followertracker.crawl.model.CrawlState;
import com.followertracker.crawl.model.EndpointCategory;
import com.followertracker.crawl.model.FetchResult;
import com.followertracker.crawl.model.FollowerPage;
import com.followertracker.crawl.model.FollowerRecord;
import com.followertracker.crawl.model.FollowerStatus;
import com.followertracker.crawl.model.QuotaObservation;
import com.followertracker.crawl.persistence.FollowerJdbcRepository;
import com.followertracker.crawl.persistence.StoreLeaseRepository;
import com.followertracker.crawl.persistence.StoreTestSupport;
import com.followertracker.crawl.util.ReasonCodeClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
class CrawlCoordinatorTest {
    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
    private static final String ACCOUNT = "tracked";

    @Autowired
    private NamedParameterJdbcTemplate namedJdbc;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private StoreLeaseRepository leaseRepository;

    @TempDir
    Path tempDir;

    private CrawlerProperties properties;
    private FollowerJdbcRepository repository;
    private MutableClock clock;
    private QuotaTracker quotaTracker;
    private BackoffPolicy backoffPolicy;
    private List<Duration> sleeps;
    private ScriptedFollowerApiClient api;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        StoreTestSupport.reset(jdbcTemplate);
        properties = new CrawlerProperties();
        properties.getStore().setSyncWrites(false);
        properties.getEnrichment().setWorkerCount(4);
        repository = new FollowerJdbcRepository(namedJdbc, transactionTemplate, properties);
        clock = new MutableClock(START);
        quotaTracker = new QuotaTracker(clock, properties.getQuota());
        backoffPolicy = new BackoffPolicy(2, 10, 100);
        sleeps = Collections.synchronizedList(new ArrayList<>());
        api = new ScriptedFollowerApiClient(clock);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void listsEveryPageThenEnrichesEveryFollower() {
        executor.shutdownNow();
        executor = Executors.newSingleThreadExecutor();
        List<FollowerRecord> afterListing = Collections.synchronizedList(new ArrayList<>());
        api.onPage(null, ScriptedFollowerApiClient.page("X", "A", "B"))
            .onPage("X", ScriptedFollowerApiClient.page(null, "C"))
            .onProfile(id -> {
                if (afterListing.isEmpty()) {
                    afterListing.addAll(repository.findFollowers(10));
                }
                return "C".equals(id)
                    ? FetchResult.notFound(ReasonCodeClassifier.ACCOUNT_NOT_FOUND, null)
                    : FetchResult.ok(ScriptedFollowerApiClient.profile(id), null);
            });

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(afterListing)
            .extracting(FollowerRecord::followerId, FollowerRecord::status)
            .containsExactly(
                tuple("A", FollowerStatus.DISCOVERED),
                tuple("B", FollowerStatus.DISCOVERED),
                tuple("C", FollowerStatus.DISCOVERED)
            );
        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.pagesFetched()).isEqualTo(2);
        assertThat(outcome.newFollowers()).isEqualTo(3);
        assertThat(outcome.profilesFetched()).isEqualTo(2);
        assertThat(outcome.profilesFailed()).isEqualTo(1);
        assertThat(api.pageCalls()).containsExactly(ScriptedFollowerApiClient.FIRST, "X");

        assertThat(repository.findFollowers(10))
            .extracting(FollowerRecord::followerId, FollowerRecord::status)
            .containsExactly(
                tuple("A", FollowerStatus.PROFILE_FETCHED),
                tuple("B", FollowerStatus.PROFILE_FETCHED),
                tuple("C", FollowerStatus.PROFILE_FAILED)
            );
        CrawlCheckpoint checkpoint = repository.loadCheckpoint();
        assertThat(checkpoint.isListingComplete()).isTrue();
        assertThat(checkpoint.pagesFetched()).isEqualTo(2);
        assertThat(checkpoint.enrichmentMarker()).isEqualTo(3);
    }

    @Test
    void crashBeforeCheckpointRefetchesPageWithoutDuplicates() {
        api.onPage(null, ScriptedFollowerApiClient.page("c1", "A", "B"))
            .onPage("c1", ScriptedFollowerApiClient.page(null, "C"));
        FollowerJdbcRepository crashing = Mockito.spy(repository);
        doThrow(new DataAccessResourceFailureException("disk gone"))
            .when(crashing)
            .saveCheckpoint(argThat(checkpoint -> checkpoint != null && "c1".equals(checkpoint.listingCursor())));

        CrawlOutcome crashed = coordinator(crashing).run(request(null));

        assertThat(crashed.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(crashed.errorKind()).isEqualTo(CrawlErrorKind.STORAGE);
        assertThat(repository.findFollowers(10)).hasSize(2);
        assertThat(repository.loadCheckpoint().isListingStarted()).isFalse();

        CrawlOutcome resumed = coordinator(repository).run(request(null));

        assertThat(resumed.state()).isEqualTo(CrawlState.DONE);
        assertThat(resumed.newFollowers()).isEqualTo(1);
        assertThat(api.pageCalls())
            .containsExactly(ScriptedFollowerApiClient.FIRST, ScriptedFollowerApiClient.FIRST, "c1");
        assertThat(repository.findFollowers(10))
            .extracting(FollowerRecord::followerId)
            .containsExactly("A", "B", "C");
        assertThat(api.profileCalls("A")).isEqualTo(1);
    }

    @Test
    void resumesFromSavedCursorWithoutRefetchingEarlierPages() {
        CrawlCheckpoint bound = repository.bindAccount(ACCOUNT);
        repository.upsertFollowers(List.of("A", "B"));
        repository.saveCheckpoint(bound.withListingCursor("c1", 1));
        api.onPage("c1", ScriptedFollowerApiClient.page(null, "C"));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(api.pageCalls()).containsExactly("c1");
        assertThat(repository.loadCheckpoint().pagesFetched()).isEqualTo(2);
        assertThat(repository.countByStatus()).containsEntry(FollowerStatus.PROFILE_FETCHED, 3L);
    }

    @Test
    void waitsForQuotaResetBeforeCalling() {
        quotaTracker.observe(EndpointCategory.FOLLOWER_IDS, 0, START.plusSeconds(600));
        api.onPage(null, ScriptedFollowerApiClient.page(null, "A"));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(api.pageCallTimes().get(0)).isAfterOrEqualTo(START.plusSeconds(600));
        assertThat(sleeps).isNotEmpty();
    }

    @Test
    void rateLimitedPageIsRetriedAfterReportedReset() {
        Instant reset = START.plusSeconds(900);
        api.onPage(null, ScriptedFollowerApiClient.page("c1", "A"))
            .onPage("c1", FetchResult.rateLimited(new QuotaObservation(0, reset)), ScriptedFollowerApiClient.page(null, "B"));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(api.pageCalls()).containsExactly(ScriptedFollowerApiClient.FIRST, "c1", "c1");
        assertThat(api.pageCallTimes().get(2)).isAfterOrEqualTo(reset);
        assertThat(repository.findFollowers(10)).hasSize(2);
    }

    @Test
    void enrichmentWorkersFetchEachFollowerExactlyOnce() {
        properties.getEnrichment().setBatchSize(4);
        api.onPage(null, ScriptedFollowerApiClient.page(null, "1", "2", "3", "4", "5", "6", "7", "8", "9", "10"))
            .onProfile(id -> {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return FetchResult.ok(ScriptedFollowerApiClient.profile(id), null);
            });

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(outcome.profilesFetched()).isEqualTo(10);
        assertThat(api.totalProfileCalls()).isEqualTo(10);
        for (int i = 1; i <= 10; i++) {
            assertThat(api.profileCalls(String.valueOf(i))).as("calls for %s", i).isEqualTo(1);
        }
        assertThat(repository.countByStatus()).containsEntry(FollowerStatus.PROFILE_FETCHED, 10L);
        assertThat(repository.loadCheckpoint().enrichmentMarker()).isEqualTo(10);
    }

    @Test
    void exhaustedListingRetriesAbortTheRun() {
        api.onPage(null, FetchResult.transientError(ReasonCodeClassifier.HTTP_5XX, "http_503", null));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(outcome.exitCode()).isEqualTo(1);
        assertThat(outcome.errorKind()).isEqualTo(CrawlErrorKind.FATAL_API);
        assertThat(outcome.errorMessage()).contains(ReasonCodeClassifier.RETRIES_EXHAUSTED);
        assertThat(api.pageCalls()).hasSize(3);
        assertThat(sleeps).hasSize(2);
        assertThat(repository.loadCheckpoint().isListingStarted()).isFalse();
    }

    @Test
    void unavailableFollowersEndAsProfileFailed() {
        api.onPage(null, ScriptedFollowerApiClient.page(null, "A", "B", "C"))
            .onProfile(id -> {
                if ("B".equals(id)) {
                    return FetchResult.transientError(ReasonCodeClassifier.TIMEOUT, "timed out", null);
                }
                if ("C".equals(id)) {
                    return FetchResult.notFound(ReasonCodeClassifier.ACCOUNT_SUSPENDED, null);
                }
                return FetchResult.ok(ScriptedFollowerApiClient.profile(id), null);
            });

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(outcome.profilesFetched()).isEqualTo(1);
        assertThat(outcome.profilesFailed()).isEqualTo(2);
        assertThat(api.profileCalls("B")).isEqualTo(3);
        assertThat(api.profileCalls("C")).isEqualTo(1);
        assertThat(repository.findFollower("B").orElseThrow().failureReason())
            .isEqualTo(ReasonCodeClassifier.RETRIES_EXHAUSTED);
        assertThat(repository.findFollower("C").orElseThrow().failureReason())
            .isEqualTo(ReasonCodeClassifier.ACCOUNT_SUSPENDED);
    }

    @Test
    void fatalEnrichmentErrorAbortsAndRerunFinishes() {
        api.onPage(null, ScriptedFollowerApiClient.page(null, "A", "B"))
            .onProfile(id -> FetchResult.fatal(ReasonCodeClassifier.HTTP_401_403, "http_401", null));

        CrawlOutcome aborted = coordinator(repository).run(request(null));

        assertThat(aborted.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(aborted.errorKind()).isEqualTo(CrawlErrorKind.FATAL_API);
        assertThat(repository.countByStatus()).containsEntry(FollowerStatus.DISCOVERED, 2L);

        api.onProfile(id -> FetchResult.ok(ScriptedFollowerApiClient.profile(id), null));
        CrawlOutcome resumed = coordinator(repository).run(request(null));

        assertThat(resumed.state()).isEqualTo(CrawlState.DONE);
        assertThat(resumed.pagesFetched()).isZero();
        assertThat(repository.countByStatus()).containsEntry(FollowerStatus.PROFILE_FETCHED, 2L);
    }

    @Test
    void exitMarkerStopsAfterCurrentPage() throws Exception {
        Path marker = tempDir.resolve("exit_follower_tracker");
        api.onPage(null, ScriptedFollowerApiClient.page("c1", "A"))
            .onPage("c1", ScriptedFollowerApiClient.page(null, "B"))
            .afterPage(cursor -> {
                if (ScriptedFollowerApiClient.FIRST.equals(cursor)) {
                    touch(marker);
                }
            });

        CrawlOutcome interrupted = coordinator(repository).run(request(marker));

        assertThat(interrupted.state()).isEqualTo(CrawlState.INTERRUPTED);
        assertThat(interrupted.exitCode()).isEqualTo(2);
        assertThat(repository.loadCheckpoint().listingCursor()).isEqualTo("c1");

        Files.delete(marker);
        api.afterPage(cursor -> {
        });
        CrawlOutcome resumed = coordinator(repository).run(request(marker));

        assertThat(resumed.state()).isEqualTo(CrawlState.DONE);
        assertThat(api.pageCalls()).containsExactly(ScriptedFollowerApiClient.FIRST, "c1");
    }

    @Test
    void interruptDuringQuotaWaitEndsInterruptedAndRerunResumes() throws Exception {
        api.onPage(null, FetchResult.ok(
                new FollowerPage(List.of("A"), "c1", false),
                new QuotaObservation(0, START.plusSeconds(900))
            ))
            .onPage("c1", ScriptedFollowerApiClient.page(null, "B"));
        CountDownLatch waitingForQuota = new CountDownLatch(1);
        CrawlSleeper blockingSleeper = duration -> {
            waitingForQuota.countDown();
            Thread.sleep(60_000);
        };
        AtomicReference<CrawlOutcome> result = new AtomicReference<>();
        AtomicBoolean interruptRestored = new AtomicBoolean();
        Thread crawl = new Thread(() -> {
            result.set(coordinator(repository, blockingSleeper).run(request(null)));
            interruptRestored.set(Thread.currentThread().isInterrupted());
        }, "crawl-under-test");

        crawl.start();
        assertThat(waitingForQuota.await(5, TimeUnit.SECONDS)).isTrue();
        crawl.interrupt();
        crawl.join(5000);

        assertThat(crawl.isAlive()).isFalse();
        CrawlOutcome interrupted = result.get();
        assertThat(interrupted.state()).isEqualTo(CrawlState.INTERRUPTED);
        assertThat(interrupted.exitCode()).isEqualTo(2);
        assertThat(interrupted.errorKind()).isEqualTo(CrawlErrorKind.INTERRUPTED);
        assertThat(interruptRestored).isTrue();
        assertThat(repository.loadCheckpoint().listingCursor()).isEqualTo("c1");
        assertThat(leaseRepository.findLease().lockOwner()).isNull();
        assertThat(api.pageCalls()).containsExactly(ScriptedFollowerApiClient.FIRST);

        CrawlOutcome resumed = coordinator(repository).run(request(null));

        assertThat(resumed.state()).isEqualTo(CrawlState.DONE);
        assertThat(api.pageCalls()).containsExactly(ScriptedFollowerApiClient.FIRST, "c1");
        assertThat(repository.countByStatus()).containsEntry(FollowerStatus.PROFILE_FETCHED, 2L);
    }

    @Test
    void heldLeaseAbortsWithoutTouchingStore() {
        assertThat(leaseRepository.tryAcquire("crawler-elsewhere", 300)).isTrue();
        api.onPage(null, ScriptedFollowerApiClient.page(null, "A"));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(outcome.errorKind()).isEqualTo(CrawlErrorKind.LEASE);
        assertThat(outcome.errorMessage()).contains("crawler-elsewhere");
        assertThat(api.pageCalls()).isEmpty();
        assertThat(repository.findFollowers(10)).isEmpty();
    }

    @Test
    void leaseLeftByCrashedProcessIsReclaimedOnRestart() {
        String crashedOwner = StoreLeaseService.OWNER_PREFIX + StoreLeaseServiceTest.exitedPid()
            + "@" + StoreLeaseServiceTest.localHost() + "-deadbeef";
        assertThat(leaseRepository.tryAcquire(crashedOwner, 300)).isTrue();
        api.onPage(null, ScriptedFollowerApiClient.page(null, "A"));

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.DONE);
        assertThat(outcome.exitCode()).isZero();
        assertThat(repository.findFollowers(10))
            .extracting(FollowerRecord::followerId, FollowerRecord::status)
            .containsExactly(tuple("A", FollowerStatus.PROFILE_FETCHED));
        assertThat(leaseRepository.findLease().lockOwner()).isNull();
    }

    @Test
    void storeBoundToAnotherAccountIsRefused() {
        repository.bindAccount("someone-else");

        CrawlOutcome outcome = coordinator(repository).run(request(null));

        assertThat(outcome.state()).isEqualTo(CrawlState.ABORTED);
        assertThat(outcome.errorKind()).isEqualTo(CrawlErrorKind.ACCOUNT_MISMATCH);
        assertThat(api.pageCalls()).isEmpty();
        assertThat(leaseRepository.findLease().lockOwner()).isNull();
    }

    private CrawlCoordinator coordinator(FollowerJdbcRepository store) {
        return coordinator(store, duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        });
    }

    private CrawlCoordinator coordinator(FollowerJdbcRepository store, CrawlSleeper sleeper) {
        PageFetcher pageFetcher = new PageFetcher(api, quotaTracker, backoffPolicy, sleeper);
        ProfileEnricher enricher = new ProfileEnricher(store, pageFetcher, executor, properties);
        return new CrawlCoordinator(store, new StoreLeaseService(leaseRepository, properties), pageFetcher, enricher);
    }

    private CrawlRequest request(Path exitMarker) {
        return new CrawlRequest(ACCOUNT, new ApiCredentials("test-token"), exitMarker);
    }

    private static void touch(Path path) {
        try {
            Files.createFile(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
