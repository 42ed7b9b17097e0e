package com.followertracker.crawl.service;

import com.followertracker.config.CrawlerProperties;
import com.followertracker.crawl.model.StoreLease;
import com.followertracker.crawl.persistence.StoreLeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exclusive, heartbeat-renewed lease over the store so two crawlers never interleave
 * checkpoint writes. Owners are named {@code crawler-<pid>@<host>-<suffix>}; a lease left by
 * a process on this host that no longer exists is reclaimed without waiting for it to expire.
 */
@Service
public class StoreLeaseService {
    private static final Logger log = LoggerFactory.getLogger(StoreLeaseService.class);
    static final String OWNER_PREFIX = "crawler-";

    private final StoreLeaseRepository leaseRepository;
    private final CrawlerProperties properties;
    private final String processIdentity;

    public StoreLeaseService(StoreLeaseRepository leaseRepository, CrawlerProperties properties) {
        this.leaseRepository = leaseRepository;
        this.properties = properties;
        this.processIdentity = ManagementFactory.getRuntimeMXBean().getName();
    }

    public Lease acquire() {
        String owner = OWNER_PREFIX + processIdentity + "-" + UUID.randomUUID().toString().substring(0, 8);
        long ttlSeconds = properties.getStore().getLeaseTtlSeconds();
        if (!leaseRepository.tryAcquire(owner, ttlSeconds) && !reclaimAbandoned(owner, ttlSeconds)) {
            StoreLease current = leaseRepository.findLease();
            String holder = current == null ? "unknown" : current.lockOwner();
            String until = current == null || current.lockedUntil() == null ? "unknown" : current.lockedUntil().toString();
            throw new StoreLeaseException("Store is held by " + holder + " until " + until);
        }

        AtomicBoolean lost = new AtomicBoolean(false);
        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("store-lease-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long intervalSeconds = properties.getStore().getLeaseHeartbeatSeconds();
        // Once the next renewal would land after expiry, treat the lease as gone.
        long toleratedFailures = Math.max(0, ttlSeconds / intervalSeconds - 2);
        AtomicInteger failedRenewals = new AtomicInteger();
        heartbeat.scheduleAtFixedRate(
            () -> {
                try {
                    if (!leaseRepository.renew(owner, ttlSeconds)) {
                        lost.set(true);
                        log.warn("Store lease {} was taken over", owner);
                        return;
                    }
                    failedRenewals.set(0);
                } catch (RuntimeException e) {
                    int failures = failedRenewals.incrementAndGet();
                    log.warn("Store lease heartbeat failed for {} ({} in a row)", owner, failures, e);
                    if (failures > toleratedFailures && lost.compareAndSet(false, true)) {
                        log.error("Store lease {} could not be renewed before expiry", owner);
                    }
                }
            },
            intervalSeconds,
            intervalSeconds,
            TimeUnit.SECONDS
        );
        log.info("Acquired store lease {} (ttl {}s)", owner, ttlSeconds);
        return new Lease(owner, heartbeat, lost);
    }

    private boolean reclaimAbandoned(String owner, long ttlSeconds) {
        StoreLease current = leaseRepository.findLease();
        if (current == null || !heldByExitedProcess(current.lockOwner())) {
            return false;
        }
        if (!leaseRepository.takeOver(current.lockOwner(), owner, ttlSeconds)) {
            return false;
        }
        log.warn("Reclaimed store lease left by exited process {}", current.lockOwner());
        return true;
    }

    /**
     * True only for owners from this host whose process is gone. Anything unparseable, remote
     * or from this very process counts as alive.
     */
    boolean heldByExitedProcess(String lockOwner) {
        if (lockOwner == null || !lockOwner.startsWith(OWNER_PREFIX)) {
            return false;
        }
        int suffixStart = lockOwner.lastIndexOf('-');
        if (suffixStart <= OWNER_PREFIX.length()) {
            return false;
        }
        String identity = lockOwner.substring(OWNER_PREFIX.length(), suffixStart);
        int at = identity.indexOf('@');
        if (at <= 0 || !identity.substring(at + 1).equals(localHost())) {
            return false;
        }
        long pid;
        try {
            pid = Long.parseLong(identity.substring(0, at));
        } catch (NumberFormatException e) {
            return false;
        }
        if (pid == ProcessHandle.current().pid()) {
            return false;
        }
        return ProcessHandle.of(pid).map(handle -> !handle.isAlive()).orElse(true);
    }

    private String localHost() {
        int at = processIdentity.indexOf('@');
        return at < 0 ? processIdentity : processIdentity.substring(at + 1);
    }

    public final class Lease implements AutoCloseable {
        private final String owner;
        private final ScheduledExecutorService heartbeat;
        private final AtomicBoolean lost;

        private Lease(String owner, ScheduledExecutorService heartbeat, AtomicBoolean lost) {
            this.owner = owner;
            this.heartbeat = heartbeat;
            this.lost = lost;
        }

        public String owner() {
            return owner;
        }

        public void ensureHeld() {
            if (lost.get()) {
                throw new StoreLeaseException("Store lease " + owner + " was lost");
            }
        }

        @Override
        public void close() {
            heartbeat.shutdownNow();
            if (lost.get()) {
                return;
            }
            try {
                leaseRepository.release(owner);
                log.info("Released store lease {}", owner);
            } catch (DataAccessException e) {
                log.warn("Failed to release store lease {}; it expires on its own", owner, e);
            }
        }
    }
}
