package com.followertracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "follower-tracker/0.1 (+contact)";
    private static final int MAX_RESPONSE_BYTES_CAP = 64 * 1024 * 1024;

    private Api api = new Api();
    private Retry retry = new Retry();
    private Quota quota = new Quota();
    private Enrichment enrichment = new Enrichment();
    private Store store = new Store();
    private Cli cli = new Cli();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Quota getQuota() {
        return quota;
    }

    public void setQuota(Quota quota) {
        this.quota = quota;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public void setEnrichment(Enrichment enrichment) {
        this.enrichment = enrichment;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Api {
        private String baseUrl = "https://api.twitter.com";
        private String userAgent;
        private int requestTimeoutSeconds = 20;
        private int followerPageSize = 5000;
        private int maxResponseBytes = 4 * 1024 * 1024;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getFollowerPageSize() {
            return Math.max(1, Math.min(5000, followerPageSize));
        }

        public void setFollowerPageSize(int followerPageSize) {
            this.followerPageSize = Math.max(1, Math.min(5000, followerPageSize));
        }

        public int getMaxResponseBytes() {
            return Math.max(1, Math.min(MAX_RESPONSE_BYTES_CAP, maxResponseBytes));
        }

        public void setMaxResponseBytes(int maxResponseBytes) {
            this.maxResponseBytes = Math.max(1, Math.min(MAX_RESPONSE_BYTES_CAP, maxResponseBytes));
        }
    }

    public static class Retry {
        private int maxRetries = 5;
        private int baseDelayMs = 1000;
        private int maxDelayMs = 60000;

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Quota {
        private int resetSlackSeconds = 2;
        private int followerIdsLimit = 15;
        private int userShowLimit = 900;
        private int windowMinutes = 15;

        public int getResetSlackSeconds() {
            return Math.max(0, resetSlackSeconds);
        }

        public void setResetSlackSeconds(int resetSlackSeconds) {
            this.resetSlackSeconds = Math.max(0, resetSlackSeconds);
        }

        public int getFollowerIdsLimit() {
            return Math.max(1, followerIdsLimit);
        }

        public void setFollowerIdsLimit(int followerIdsLimit) {
            this.followerIdsLimit = Math.max(1, followerIdsLimit);
        }

        public int getUserShowLimit() {
            return Math.max(1, userShowLimit);
        }

        public void setUserShowLimit(int userShowLimit) {
            this.userShowLimit = Math.max(1, userShowLimit);
        }

        public int getWindowMinutes() {
            return Math.max(1, windowMinutes);
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = Math.max(1, windowMinutes);
        }
    }

    public static class Enrichment {
        private int batchSize = 100;
        private int workerCount = 4;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }
    }

    public static class Store {
        private String path = "./followers";
        private long leaseTtlSeconds = 120;
        private long leaseHeartbeatSeconds = 30;
        private boolean syncWrites = true;

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public long getLeaseTtlSeconds() {
            return Math.max(1, leaseTtlSeconds);
        }

        public void setLeaseTtlSeconds(long leaseTtlSeconds) {
            this.leaseTtlSeconds = Math.max(1, leaseTtlSeconds);
        }

        public long getLeaseHeartbeatSeconds() {
            return Math.max(1, Math.min(leaseHeartbeatSeconds, getLeaseTtlSeconds()));
        }

        public void setLeaseHeartbeatSeconds(long leaseHeartbeatSeconds) {
            this.leaseHeartbeatSeconds = Math.max(1, leaseHeartbeatSeconds);
        }

        public boolean isSyncWrites() {
            return syncWrites;
        }

        public void setSyncWrites(boolean syncWrites) {
            this.syncWrites = syncWrites;
        }
    }

    public static class Cli {
        private boolean run;
        private String account = "";
        private String credentials = ".twitter.json";
        private String exitMarker = "./exit_follower_tracker";
        private boolean exitAfterRun = true;
        private int shutdownTimeoutSeconds = 30;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getAccount() {
            return account;
        }

        public void setAccount(String account) {
            this.account = account;
        }

        public String getCredentials() {
            return credentials;
        }

        public void setCredentials(String credentials) {
            this.credentials = credentials;
        }

        public String getExitMarker() {
            return exitMarker;
        }

        public void setExitMarker(String exitMarker) {
            this.exitMarker = exitMarker;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }

        public int getShutdownTimeoutSeconds() {
            return Math.max(1, shutdownTimeoutSeconds);
        }

        public void setShutdownTimeoutSeconds(int shutdownTimeoutSeconds) {
            this.shutdownTimeoutSeconds = Math.max(1, shutdownTimeoutSeconds);
        }
    }
}
