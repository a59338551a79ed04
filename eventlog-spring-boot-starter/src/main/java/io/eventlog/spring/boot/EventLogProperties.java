package io.eventlog.spring.boot;

import io.eventlog.bus.OverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the event log.
 *
 * @see EventLogAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventlog")
public class EventLogProperties {

    /**
     * Database table name for events.
     */
    private String tableName = "event_log";

    /**
     * Database table name for the single-row global sequence counter.
     */
    private String sequenceTableName = "event_log_sequence";

    /**
     * Whether to create the event tables on startup if they are missing.
     */
    private boolean initializeSchema = false;

    private final Runtime runtime = new Runtime();
    private final Retry retry = new Retry();
    private final Bus bus = new Bus();
    private final Feed feed = new Feed();
    private final Tasks tasks = new Tasks();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getSequenceTableName() {
        return sequenceTableName;
    }

    public void setSequenceTableName(String sequenceTableName) {
        this.sequenceTableName = sequenceTableName;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public Runtime getRuntime() {
        return runtime;
    }

    public Retry getRetry() {
        return retry;
    }

    public Bus getBus() {
        return bus;
    }

    public Feed getFeed() {
        return feed;
    }

    public Tasks getTasks() {
        return tasks;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Runtime {
        private int maxConflictAttempts = 5;
        private int maxStorageAttempts = 3;
        private int executorThreads = 4;

        public int getMaxConflictAttempts() {
            return maxConflictAttempts;
        }

        public void setMaxConflictAttempts(int maxConflictAttempts) {
            this.maxConflictAttempts = maxConflictAttempts;
        }

        public int getMaxStorageAttempts() {
            return maxStorageAttempts;
        }

        public void setMaxStorageAttempts(int maxStorageAttempts) {
            this.maxStorageAttempts = maxStorageAttempts;
        }

        public int getExecutorThreads() {
            return executorThreads;
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = executorThreads;
        }
    }

    public static class Retry {
        private long baseDelayMs = 50;
        private long maxDelayMs = 2000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Bus {
        /**
         * Events buffered per subscriber before the overflow policy applies.
         */
        private int bufferCapacity = 256;
        private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_OLDEST;
        private long blockTimeoutMs = 1000;

        public int getBufferCapacity() {
            return bufferCapacity;
        }

        public void setBufferCapacity(int bufferCapacity) {
            this.bufferCapacity = bufferCapacity;
        }

        public OverflowPolicy getOverflowPolicy() {
            return overflowPolicy;
        }

        public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
        }

        public long getBlockTimeoutMs() {
            return blockTimeoutMs;
        }

        public void setBlockTimeoutMs(long blockTimeoutMs) {
            this.blockTimeoutMs = blockTimeoutMs;
        }
    }

    public static class Feed {
        private long keepAliveMs = 15000;
        private int replayPageSize = 500;

        public long getKeepAliveMs() {
            return keepAliveMs;
        }

        public void setKeepAliveMs(long keepAliveMs) {
            this.keepAliveMs = keepAliveMs;
        }

        public int getReplayPageSize() {
            return replayPageSize;
        }

        public void setReplayPageSize(int replayPageSize) {
            this.replayPageSize = replayPageSize;
        }
    }

    public static class Tasks {
        private int workerCount = 4;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventlog";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
