package io.prayernotify.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prayernotify.JobBuilder;
import io.prayernotify.JobHandler;
import io.prayernotify.TaskQueue;
import io.prayernotify.config.QueueProperties;
import io.prayernotify.core.JobHandlerRegistry;
import io.prayernotify.core.JobSpec;
import io.prayernotify.core.PersistResult;
import io.prayernotify.internal.SimpleJobBuilder;
import io.prayernotify.utils.RecurrenceRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mongo-backed delayed task queue.
 *
 * <p>A poller thread claims jobs due within the next {@code processEvery} window, a dispatcher
 * releases each one at its {@code nextRunAt}, and a bounded worker pool runs the registered
 * {@link JobHandler}. Handler failures are retried with exponential backoff until
 * {@code maxRetryCount}.
 *
 * <p>Finished one-off jobs that carry a unique key are kept (with {@code nextRunAt} cleared) so
 * that the key stays reserved and a later create with the same key is still rejected.
 */
public class MongoTaskQueue implements TaskQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoTaskQueue.class);

    private final QueueProperties props;
    private final MongoJobStore jobStore;
    private final JobHandlerRegistry jobRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ExecutorService workerPool;

    private Thread pollerThread;
    private Thread dispatcherThread;

    private final DelayQueue<DelayedJob> queue = new DelayQueue<>();
    private final ConcurrentHashMap<String, Boolean> enqueued = new ConcurrentHashMap<>();

    private final Semaphore refillSignal = new Semaphore(0);

    private final AtomicReference<Instant> windowCursor = new AtomicReference<>();

    private final Semaphore workerSem;
    private int systemErrorCount = 0;

    private final String workerId;

    private final class DelayedJob implements Delayed {
        private final ScheduledJobDocument doc;
        private final Instant runAt;

        private DelayedJob(ScheduledJobDocument doc) {
            this.doc = doc;
            this.runAt = doc.getNextRunAt();
        }

        @Override
        public long getDelay(TimeUnit unit) {
            long ms = Duration.between(clock.instant(), runAt).toMillis();
            return unit.convert(ms, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            if (other == this) return 0;
            if (other instanceof DelayedJob o) {
                return this.runAt.compareTo(o.runAt);
            }
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }
    }

    public MongoTaskQueue(QueueProperties props, MongoJobStore jobStore, JobHandlerRegistry jobRegistry, ObjectMapper objectMapper) {
        this(props, jobStore, jobRegistry, objectMapper, Clock.systemUTC());
    }

    public MongoTaskQueue(QueueProperties props,
                          MongoJobStore jobStore,
                          JobHandlerRegistry jobRegistry,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workerSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "prayer.queue.process-every must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("prayer.queue.process-every must be a positive duration");
        }

        Duration lockLifetime = Objects.requireNonNull(props.getLockLifetime(), "prayer.queue.lock-lifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("prayer.queue.lock-lifetime must be a positive duration");
        }

        log.info("Task queue starting with handlers={}, processEvery={}, lockLifetime={}, workerId={}, maxConcurrency={}, lockLimit={}, batchSize={}",
                jobRegistry.names(),
                props.getProcessEvery(),
                props.getLockLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getLockLimit(),
                props.getBatchSize());

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("task-queue.worker");
                t.setDaemon(true);
                return t;
            });
        }

        windowCursor.compareAndSet(null, clock.instant());

        if (dispatcherThread == null) {
            dispatcherThread = new Thread(this::dispatchLoop);
            dispatcherThread.setName("task-queue.dispatcher");
            dispatcherThread.setDaemon(true);
            dispatcherThread.start();
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("task-queue.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("Task queue started.");
    }

    /**
     * Stop polling and executing. Idempotent. Claimed but unstarted jobs are dropped from memory;
     * their locks expire and another worker picks them up.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Task queue stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getLockLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            dispatcherThread = null;
        }

        queue.clear();
        enqueued.clear();
        refillSignal.drainPermits();
        windowCursor.set(null);
        log.info("Task queue stopped.");
    }

    public boolean isStarted() {
        return started.get();
    }

    /**
     * Create a job builder. Nothing is persisted until {@code save()}.
     */
    @Override
    public <T> JobBuilder<T> create(String name, T data) {
        return new SimpleJobBuilder<>(name, data, jobStore::save, clock);
    }

    @Override
    public <T> JobBuilder<T> schedule(String name, Instant time, T data) {
        return this.create(name, data)
                .schedule(time);
    }

    @Override
    public <T> PersistResult every(String name, String rule, String timezone, T data) {
        JobBuilder<T> b = this.create(name, data).single();
        if (timezone != null) {
            b.timezone(timezone);
        }
        return b.repeat(rule).save();
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "prayer-notify";
        }

        String generated = host + "-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("Task queue poll failed attempt={} msg={}", systemErrorCount, e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("Task queue stopped due to repeated system failures");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);
                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    Thread.sleep(props.getProcessEvery().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // exponential backoff for repeated poll-loop failures
    private static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Handler retry delay; attempt starts at 1. 10s, 20s, 40s... capped at 10 minutes.
     */
    static Duration retryDelay(int attempt) {
        int exp = Math.max(0, attempt - 1);
        exp = Math.min(exp, 20);
        long ms = Math.min(10_000L * (1L << exp), 600_000L);
        return Duration.ofMillis(ms);
    }

    private boolean pollOnce() {
        Instant windowStart = windowCursor.get();
        Instant now = clock.instant();
        if (windowStart == null || windowStart.isBefore(now)) {
            windowStart = now;
        }

        Instant windowEnd = windowStart.plus(props.getProcessEvery());

        int running = props.getMaxConcurrency() - workerSem.availablePermits();
        int inFlight = enqueued.size() + Math.max(0, running);

        int lockLimit = props.getLockLimit();
        int remaining = lockLimit <= 0 ? Integer.MAX_VALUE : Math.max(0, lockLimit - inFlight);

        if (remaining == 0) {
            windowCursor.set(windowEnd);
            return true;
        }

        int batchSize = Math.max(1, props.getBatchSize());
        boolean backlog = false;

        while (remaining > 0) {
            int take = Math.min(batchSize, remaining);

            var jobs = jobStore.claimDueJobs(windowEnd, take, props.getLockLifetime(), workerId);

            log.debug("Task queue polled jobs count={} windowEnd={} remaining={}", jobs.size(), windowEnd, remaining);

            for (var job : jobs) {
                if (enqueued.putIfAbsent(job.getId(), Boolean.TRUE) == null) {
                    queue.offer(new DelayedJob(job));
                    remaining--;
                    if (remaining == 0) {
                        break;
                    }
                }
            }

            if (jobs.size() < take) {
                break;
            }

            if (remaining == 0) {
                backlog = true;
                break;
            }
        }

        windowCursor.set(windowEnd);
        return backlog;
    }

    private void dispatchLoop() {
        while (started.get()) {
            try {
                DelayedJob dj = queue.take();
                ScheduledJobDocument job = dj.doc;

                enqueued.remove(job.getId());
                submitToWorker(job);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Task queue dispatcher failed msg={}", e.getMessage(), e);
            }
        }
    }

    private void submitToWorker(ScheduledJobDocument job) throws InterruptedException {
        workerSem.acquire();
        try {
            workerPool.submit(() -> runJob(job));
        } catch (RuntimeException e) {
            workerSem.release();
            throw e;
        }
    }

    private void runJob(ScheduledJobDocument job) {
        String name = job.getName();
        try {
            var handler = jobRegistry.getRequired(name);
            JobSpec<?> spec = jobStore.toSpec(job, handler.dataClass());

            Instant startedAt = clock.instant();
            log.debug("Task started name={} id={} key={} at={}", name, job.getId(), job.getUniqueKey(), startedAt);
            executeHandler(handler, spec.data());
            Instant finishedAt = clock.instant();

            log.debug("Task succeeded name={} id={} at={}", name, job.getId(), finishedAt);

            Instant next = RecurrenceRules.computeNextRunAt(
                    spec.repeatRule(),
                    spec.repeatTimezone(),
                    spec.nextRunAt(),
                    finishedAt
            );

            // keyed one-off jobs stay behind as tombstones so their key remains taken
            if (next == null && spec.uniqueKey() == null && props.isCleanupFinishedJobs()) {
                jobStore.deleteById(job.getId());
            } else {
                jobStore.markSuccess(job.getId(), workerId, startedAt, finishedAt, next);
            }
        } catch (Exception e) {
            log.error("Task failed name={} id={} key={} msg={}", name, job.getId(), job.getUniqueKey(), e.getMessage(), e);
            recordFailure(job, e);
        } finally {
            workerSem.release();
            refillSignal.release();
        }
    }

    private void recordFailure(ScheduledJobDocument job, Exception cause) {
        Instant failedAt = clock.instant();
        int nextAttempt = job.getFailCount() + 1;

        Instant nextRunAt;
        int maxRetry = props.getMaxRetryCount();
        if (maxRetry > 0 && nextAttempt >= maxRetry) {
            nextRunAt = recurringNextRun(job, failedAt);
            log.warn("Task reached max retries name={} id={} attempts={} maxRetry={}",
                    job.getName(), job.getId(), nextAttempt, maxRetry);
        } else {
            nextRunAt = failedAt.plus(retryDelay(nextAttempt));
        }

        try {
            jobStore.markFailure(job.getId(), workerId, failedAt, cause.getMessage(), nextRunAt);
        } catch (RuntimeException storeEx) {
            log.error("Task markFailure failed name={} id={} msg={}", job.getName(), job.getId(), storeEx.getMessage(), storeEx);
        }
    }

    // a recurring job that exhausted its retries still gets its next regular run
    private static Instant recurringNextRun(ScheduledJobDocument job, Instant failedAt) {
        if (job.getRepeatRule() == null) {
            return null;
        }
        return RecurrenceRules.computeNextRunAt(job.getRepeatRule(), job.getRepeatTimezone(), job.getNextRunAt(), failedAt);
    }

    @SuppressWarnings("unchecked")
    private <T> void executeHandler(JobHandler<?> handler, Object rawData) throws Exception {
        var h = (JobHandler<T>) handler;
        T data = (rawData == null) ? null : objectMapper.convertValue(rawData, h.dataClass());
        h.execute(data);
    }
}
