package com.followertracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.followertracker.crawl.http.BackoffPolicy;
import com.followertracker.crawl.http.QuotaTracker;
import com.followertracker.crawl.service.CrawlSleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CrawlConfig {

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdownNow")
    public ExecutorService enrichmentExecutor(CrawlerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getEnrichment().getWorkerCount(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("profile-enricher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(2, properties.getEnrichment().getWorkerCount());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock crawlClock() {
        return Clock.systemUTC();
    }

    @Bean
    public QuotaTracker quotaTracker(Clock crawlClock, CrawlerProperties properties) {
        return new QuotaTracker(crawlClock, properties.getQuota());
    }

    @Bean
    public BackoffPolicy backoffPolicy(CrawlerProperties properties) {
        return BackoffPolicy.from(properties.getRetry());
    }

    @Bean
    public CrawlSleeper crawlSleeper() {
        return CrawlSleeper.threadSleeper();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
