package com.ivamare.ordersession;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Configuration properties for order sessions.
 *
 * <p>Example configuration:
 * <pre>
 * ordersession:
 *   enabled: true
 *   storage: jdbc
 *   store:
 *     query-timeout-seconds: 5
 *   command-retry:
 *     max-attempts: 5
 *     backoff-schedule-ms: [10, 25, 50, 100]
 *     jitter: 0.5
 *   snapshot:
 *     enabled: true
 *     interval: 50
 *     keep-latest: 2
 *   projection:
 *     concurrency: 2
 *     max-attempts: 3
 *     backoff-schedule-ms: [100, 500]
 *     rebuild-page-size: 500
 *     rebuild-on-startup: false
 * </pre>
 */
@ConfigurationProperties(prefix = "ordersession")
public class OrderSessionProperties {

    /**
     * Where events, snapshots and dead letters are kept.
     */
    public enum Storage {
        /** PostgreSQL through JdbcTemplate */
        JDBC,
        /** Process memory, for tests and demos */
        MEMORY
    }

    /**
     * Enable/disable order session auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Storage backend.
     */
    private Storage storage = Storage.JDBC;

    /**
     * Event store configuration.
     */
    private StoreProperties store = new StoreProperties();

    /**
     * Retry of commands that lose an append race.
     */
    private RetryProperties commandRetry = new RetryProperties(5, List.of(10L, 25L, 50L, 100L), 0.5);

    /**
     * Snapshot configuration.
     */
    private SnapshotProperties snapshot = new SnapshotProperties();

    /**
     * Projection engine configuration.
     */
    private ProjectionProperties projection = new ProjectionProperties();

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public StoreProperties getStore() {
        return store;
    }

    public void setStore(StoreProperties store) {
        this.store = store;
    }

    public RetryProperties getCommandRetry() {
        return commandRetry;
    }

    public void setCommandRetry(RetryProperties commandRetry) {
        this.commandRetry = commandRetry;
    }

    public SnapshotProperties getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(SnapshotProperties snapshot) {
        this.snapshot = snapshot;
    }

    public ProjectionProperties getProjection() {
        return projection;
    }

    public void setProjection(ProjectionProperties projection) {
        this.projection = projection;
    }

    /**
     * Event store configuration.
     */
    public static class StoreProperties {

        /**
         * Statement timeout for event store queries; 0 means the driver default.
         */
        private int queryTimeoutSeconds = 5;

        public int getQueryTimeoutSeconds() {
            return queryTimeoutSeconds;
        }

        public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
            this.queryTimeoutSeconds = queryTimeoutSeconds;
        }
    }

    /**
     * Bounded retry with jittered backoff.
     */
    public static class RetryProperties {

        /**
         * Maximum attempts, including the first.
         */
        private int maxAttempts;

        /**
         * Delay in milliseconds before each retry; the last value repeats.
         */
        private List<Long> backoffScheduleMs;

        /**
         * Random spread applied to each delay, as a fraction of it.
         */
        private double jitter;

        public RetryProperties() {
            this(3, List.of(100L, 500L), 0.2);
        }

        public RetryProperties(int maxAttempts, List<Long> backoffScheduleMs, double jitter) {
            this.maxAttempts = maxAttempts;
            this.backoffScheduleMs = backoffScheduleMs;
            this.jitter = jitter;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<Long> getBackoffScheduleMs() {
            return backoffScheduleMs;
        }

        public void setBackoffScheduleMs(List<Long> backoffScheduleMs) {
            this.backoffScheduleMs = backoffScheduleMs;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Snapshot configuration.
     */
    public static class SnapshotProperties {

        /**
         * Take snapshots at all.
         */
        private boolean enabled = true;

        /**
         * Events between snapshots.
         */
        private int interval = 50;

        /**
         * Snapshots kept per session after pruning.
         */
        private int keepLatest = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getInterval() {
            return interval;
        }

        public void setInterval(int interval) {
            this.interval = interval;
        }

        public int getKeepLatest() {
            return keepLatest;
        }

        public void setKeepLatest(int keepLatest) {
            this.keepLatest = keepLatest;
        }
    }

    /**
     * Projection engine configuration.
     */
    public static class ProjectionProperties {

        /**
         * Threads dispatching events to subscribers.
         */
        private int concurrency = 2;

        /**
         * Attempts per event before it is dead-lettered.
         */
        private int maxAttempts = 3;

        /**
         * Delay in milliseconds before each projection retry.
         */
        private List<Long> backoffScheduleMs = List.of(100L, 500L);

        /**
         * Events read per page during a rebuild.
         */
        private int rebuildPageSize = 500;

        /**
         * Replay the whole log into the projections when the context starts.
         */
        private boolean rebuildOnStartup = false;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public List<Long> getBackoffScheduleMs() {
            return backoffScheduleMs;
        }

        public void setBackoffScheduleMs(List<Long> backoffScheduleMs) {
            this.backoffScheduleMs = backoffScheduleMs;
        }

        public int getRebuildPageSize() {
            return rebuildPageSize;
        }

        public void setRebuildPageSize(int rebuildPageSize) {
            this.rebuildPageSize = rebuildPageSize;
        }

        public boolean isRebuildOnStartup() {
            return rebuildOnStartup;
        }

        public void setRebuildOnStartup(boolean rebuildOnStartup) {
            this.rebuildOnStartup = rebuildOnStartup;
        }
    }
}
