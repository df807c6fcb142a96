package io.prayernotify.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the Mongo-backed delayed task queue.
 */
@ConfigurationProperties(prefix = "prayer.queue")
public class QueueProperties {
    private boolean enabled = true;
    private int maxConcurrency = 10;
    private int lockLimit = 0; // 0 = unbounded
    private int batchSize = 20;
    private int maxRetryCount = 5;
    private Duration lockLifetime = Duration.ofMinutes(10);
    private Duration processEvery = Duration.ofSeconds(5);
    private boolean cleanupFinishedJobs = true;
    private String workerId;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getLockLimit() {
        return lockLimit;
    }

    public void setLockLimit(int lockLimit) {
        this.lockLimit = lockLimit;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxRetryCount() {
        return maxRetryCount;
    }

    public void setMaxRetryCount(int maxRetryCount) {
        this.maxRetryCount = maxRetryCount;
    }

    public Duration getLockLifetime() {
        return lockLifetime;
    }

    public void setLockLifetime(Duration lockLifetime) {
        this.lockLifetime = lockLifetime;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public boolean isCleanupFinishedJobs() {
        return cleanupFinishedJobs;
    }

    public void setCleanupFinishedJobs(boolean cleanupFinishedJobs) {
        this.cleanupFinishedJobs = cleanupFinishedJobs;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
