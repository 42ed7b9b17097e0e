package com.followertracker.crawl.service;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.http.ApiCredentials;
import com.followertracker.crawl.http.CredentialsException;
import com.followertracker.crawl.http.CredentialsLoader;
import com.followertracker.crawl.model.CrawlErrorKind;
import com.followertracker.crawl.model.CrawlOutcome;
import com.followertracker.crawl.model.CrawlState;
import com.followertracker.crawl.model.FollowerStatus;
import com.followertracker.crawl.persistence.FollowerJdbcRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command-line entry point. The tracked account comes from the first positional argument
 * or {@code crawler.cli.account}.
 *
 * <p>On SIGINT/SIGTERM the context is closed while the crawl is still running. The crawl is
 * interrupted and awaited before the store and worker pool are torn down, and the process
 * then exits with the crawl's own exit code.
 */
@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CredentialsLoader credentialsLoader;
    private final CrawlCoordinator crawlCoordinator;
    private final FollowerJdbcRepository repository;
    private final ConfigurableApplicationContext applicationContext;
    private final AtomicReference<ActiveCrawl> activeCrawl = new AtomicReference<>();
    private volatile int shutdownExitCode = -1;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CredentialsLoader credentialsLoader,
        CrawlCoordinator crawlCoordinator,
        FollowerJdbcRepository repository,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.credentialsLoader = credentialsLoader;
        this.crawlCoordinator = crawlCoordinator;
        this.repository = repository;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }
        if (properties.getCli().isExitAfterRun()) {
            SpringApplication.getShutdownHandlers().add(this::exitWithInterruptedCode);
        }
        int exitCode = execute(args.getNonOptionArgs());
        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(List<String> positionalArgs) {
        String account = positionalArgs.isEmpty() ? properties.getCli().getAccount() : positionalArgs.get(0);
        if (account == null || account.isBlank()) {
            log.error("No account to track; pass it as an argument or set crawler.cli.account");
            return CrawlState.ABORTED.exitCode();
        }

        ApiCredentials credentials;
        try {
            credentials = credentialsLoader.load(Path.of(properties.getCli().getCredentials()));
        } catch (CredentialsException e) {
            log.error("Crawl of {} {} ({}): {}", account, CrawlState.ABORTED, CrawlErrorKind.CREDENTIALS, e.getMessage());
            return CrawlState.ABORTED.exitCode();
        }

        String exitMarker = properties.getCli().getExitMarker();
        CrawlRequest request = new CrawlRequest(
            account,
            credentials,
            exitMarker == null || exitMarker.isBlank() ? null : Path.of(exitMarker)
        );
        ActiveCrawl crawl = new ActiveCrawl(Thread.currentThread());
        activeCrawl.set(crawl);
        try {
            CrawlOutcome outcome = crawlCoordinator.run(request);
            crawl.exitCode = outcome.exitCode();
            // An interrupted thread means shutdown is underway; leave the store alone.
            if (outcome.errorKind() != CrawlErrorKind.STORAGE && !Thread.currentThread().isInterrupted()) {
                logStoreSummary(outcome);
            }
            return outcome.exitCode();
        } finally {
            activeCrawl.compareAndSet(crawl, null);
            crawl.finished.countDown();
        }
    }

    /**
     * Interrupts a running crawl and waits for it to checkpoint, before the beans it uses are
     * destroyed.
     */
    @PreDestroy
    public void stopOnShutdown() {
        ActiveCrawl crawl = activeCrawl.get();
        if (crawl == null) {
            return;
        }
        int timeoutSeconds = properties.getCli().getShutdownTimeoutSeconds();
        log.info("Shutdown requested; interrupting crawl (waiting up to {}s)", timeoutSeconds);
        crawl.thread.interrupt();
        try {
            if (crawl.finished.await(timeoutSeconds, TimeUnit.SECONDS)) {
                shutdownExitCode = crawl.exitCode;
            } else {
                log.warn("Crawl did not stop within {}s; progress since the last checkpoint is redone on rerun",
                    timeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    int shutdownExitCode() {
        return shutdownExitCode;
    }

    // Runs on the JVM shutdown hook after the context is closed; a signal would otherwise set the status.
    private void exitWithInterruptedCode() {
        int code = shutdownExitCode;
        if (code >= 0) {
            Runtime.getRuntime().halt(code);
        }
    }

    private void logStoreSummary(CrawlOutcome outcome) {
        try {
            Map<FollowerStatus, Long> counts = repository.countByStatus();
            log.info(
                "Store for {}: discovered={}, profileFetched={}, profileFailed={} (run state {})",
                outcome.account(),
                counts.getOrDefault(FollowerStatus.DISCOVERED, 0L),
                counts.getOrDefault(FollowerStatus.PROFILE_FETCHED, 0L),
                counts.getOrDefault(FollowerStatus.PROFILE_FAILED, 0L),
                outcome.state()
            );
        } catch (DataAccessException e) {
            log.warn("Could not summarize store for {}", outcome.account(), e);
        }
    }

    private static final class ActiveCrawl {
        private final Thread thread;
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile int exitCode = CrawlState.ABORTED.exitCode();

        private ActiveCrawl(Thread thread) {
            this.thread = thread;
        }
    }
}
