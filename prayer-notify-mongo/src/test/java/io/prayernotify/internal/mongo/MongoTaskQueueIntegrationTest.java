package io.prayernotify.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.prayernotify.JobHandler;
import io.prayernotify.config.MongoIndexConfig;
import io.prayernotify.config.QueueProperties;
import io.prayernotify.core.HttpTarget;
import io.prayernotify.core.JobHandlerRegistry;
import io.prayernotify.core.JobSpec;
import io.prayernotify.core.JobType;
import io.prayernotify.core.PersistResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoTaskQueueIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "prayer_notify_test");
        mongoTemplate.dropCollection(ScheduledJobDocument.class);
        new MongoIndexConfig(mongoTemplate).ensureIndexes();
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScheduledJobDocument.class);
    }

    @Test
    void keyedJobShouldBeCreatedAtMostOnce() {
        MongoTaskQueue queue = newQueue(List.of());
        Instant fireAt = Instant.now().plus(1, ChronoUnit.HOURS);

        PersistResult first = queue.create("prayer-notification", HttpTarget.postJson("http://localhost/a", "{\"n\":1}"))
                .uniqueKey("prayer_fajr_start_m1_abc_1")
                .schedule(fireAt)
                .save();
        PersistResult second = queue.create("prayer-notification", HttpTarget.postJson("http://localhost/b", "{\"n\":2}"))
                .uniqueKey("prayer_fajr_start_m1_abc_1")
                .schedule(fireAt.plusSeconds(60))
                .save();

        assertEquals(PersistResult.CREATED, first);
        assertEquals(PersistResult.ALREADY_EXISTS, second);

        ScheduledJobDocument stored = jobStore.findByNameAndUniqueKey("prayer-notification", "prayer_fajr_start_m1_abc_1");
        assertNotNull(stored);
        assertEquals(fireAt.truncatedTo(ChronoUnit.SECONDS), stored.getNextRunAt());
        assertEquals("http://localhost/a", stored.getData().get("url"));
        assertEquals(1, mongoTemplate.count(new Query(), ScheduledJobDocument.class));
    }

    @Test
    void keyWrittenByAnotherWorkerShouldBeReportedAsAlreadyExists() {
        ScheduledJobDocument existing = new ScheduledJobDocument();
        existing.setName("prayer-notification");
        existing.setType(JobType.NORMAL);
        existing.setUniqueKey("k-race");
        existing.setNextRunAt(Instant.now().plusSeconds(600));
        mongoTemplate.insert(existing);

        JobSpec<Map<String, Object>> spec = new JobSpec<>(
                "prayer-notification", "k-race", JobType.NORMAL, Instant.now().plusSeconds(600), null, null, Map.of());

        assertEquals(PersistResult.ALREADY_EXISTS, jobStore.save(spec));
    }

    @Test
    void recurringJobShouldBeUpsertedByName() {
        MongoTaskQueue queue = newQueue(List.of());

        assertEquals(PersistResult.CREATED, queue.every("prayer-daily-sweep", "AT 00:30", "Europe/London", null));
        assertEquals(PersistResult.UPDATED, queue.every("prayer-daily-sweep", "AT 00:45", "Europe/London", null));

        ScheduledJobDocument single = jobStore.findSingleByName("prayer-daily-sweep");
        assertNotNull(single);
        assertEquals("AT 00:45", single.getRepeatRule());
        assertEquals("Europe/London", single.getRepeatTimezone());
        assertEquals(1, mongoTemplate.count(new Query(), ScheduledJobDocument.class));
    }

    @Test
    void claimDueJobsShouldLockAndPreventDoubleClaim() {
        mongoTemplate.insert(newDoc("prayer-notification", Instant.now().minusSeconds(5)));

        List<ScheduledJobDocument> claimed = jobStore.claimDueJobs(
                Instant.now().plusSeconds(2), 1, Duration.ofSeconds(30), "worker-A");

        assertEquals(1, claimed.size());
        ScheduledJobDocument locked = claimed.get(0);
        assertEquals("worker-A", locked.getLockedBy());
        assertNotNull(locked.getLockUntil());

        List<ScheduledJobDocument> secondClaim = jobStore.claimDueJobs(
                Instant.now().plusSeconds(2), 1, Duration.ofSeconds(30), "worker-B");

        assertTrue(secondClaim.isEmpty());
    }

    @Test
    void finishedKeyedJobShouldStayReserved() throws Exception {
        List<Map<String, Object>> seen = new CopyOnWriteArrayList<>();
        MongoTaskQueue queue = newQueue(List.of(recordingHandler("echo", seen)));

        queue.create("echo", Map.<String, Object>of("id", "A1"))
                .uniqueKey("once")
                .schedule(Instant.now())
                .save();
        queue.start();

        boolean finished = waitUntil(8, TimeUnit.SECONDS, () -> {
            ScheduledJobDocument doc = jobStore.findByNameAndUniqueKey("echo", "once");
            return doc != null && doc.getLastFinishedAt() != null;
        });
        queue.stop();

        assertTrue(finished);
        assertEquals(1, seen.size());
        assertEquals("A1", seen.get(0).get("id"));

        ScheduledJobDocument done = jobStore.findByNameAndUniqueKey("echo", "once");
        assertNull(done.getNextRunAt());

        PersistResult again = queue.create("echo", Map.<String, Object>of("id", "A2"))
                .uniqueKey("once")
                .schedule(Instant.now())
                .save();
        assertEquals(PersistResult.ALREADY_EXISTS, again);
    }

    @Test
    void unkeyedJobShouldBeDeletedAfterSuccess() throws Exception {
        List<Map<String, Object>> seen = new CopyOnWriteArrayList<>();
        MongoTaskQueue queue = newQueue(List.of(recordingHandler("echo", seen)));

        queue.schedule("echo", Instant.now(), Map.<String, Object>of("id", "B1")).save();
        queue.start();

        boolean deleted = waitUntil(8, TimeUnit.SECONDS,
                () -> !seen.isEmpty() && mongoTemplate.count(new Query(), ScheduledJobDocument.class) == 0);
        queue.stop();

        assertTrue(deleted);
    }

    @Test
    void failedHandlerShouldIncreaseFailCountAndReschedule() throws Exception {
        JobHandler<Map<String, Object>> failingHandler = new JobHandler<>() {
            @Override
            public String name() {
                return "failing-job";
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> dataClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public void execute(Map<String, Object> data) {
                throw new IllegalStateException("simulated failure");
            }
        };

        MongoTaskQueue queue = newQueue(List.of(failingHandler));
        queue.schedule("failing-job", Instant.now(), Map.<String, Object>of("id", "A1")).save();
        queue.start();

        boolean reached = waitUntil(8, TimeUnit.SECONDS, () -> {
            ScheduledJobDocument doc = mongoTemplate.findOne(
                    new Query(Criteria.where("name").is("failing-job")), ScheduledJobDocument.class);
            return doc != null && doc.getFailCount() >= 1 && doc.getNextRunAt() != null;
        });
        queue.stop();

        assertTrue(reached);
        ScheduledJobDocument updated = mongoTemplate.findOne(
                new Query(Criteria.where("name").is("failing-job")), ScheduledJobDocument.class);
        assertNotNull(updated);
        assertEquals("simulated failure", updated.getFailReason());
        assertFalse(updated.getNextRunAt().isBefore(Instant.now().plusSeconds(5)));
    }

    @Test
    void retryDelayShouldDoubleUpToTenMinutes() {
        assertEquals(Duration.ofSeconds(10), MongoTaskQueue.retryDelay(1));
        assertEquals(Duration.ofSeconds(20), MongoTaskQueue.retryDelay(2));
        assertEquals(Duration.ofSeconds(40), MongoTaskQueue.retryDelay(3));
        assertEquals(Duration.ofMinutes(10), MongoTaskQueue.retryDelay(12));
    }

    private MongoTaskQueue newQueue(List<JobHandler<?>> handlers) {
        return new MongoTaskQueue(testProps(), jobStore, new JobHandlerRegistry(handlers), new ObjectMapper());
    }

    private static JobHandler<Map<String, Object>> recordingHandler(String name, List<Map<String, Object>> sink) {
        return new JobHandler<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> dataClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public void execute(Map<String, Object> data) {
                sink.add(data);
            }
        };
    }

    private static ScheduledJobDocument newDoc(String name, Instant nextRunAt) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setName(name);
        doc.setType(JobType.NORMAL);
        doc.setNextRunAt(nextRunAt);
        doc.setData(Map.of("k", "v"));
        return doc;
    }

    private static QueueProperties testProps() {
        QueueProperties props = new QueueProperties();
        props.setProcessEvery(Duration.ofMillis(200));
        props.setLockLifetime(Duration.ofSeconds(2));
        props.setMaxConcurrency(1);
        props.setLockLimit(10);
        props.setBatchSize(1);
        props.setMaxRetryCount(3);
        props.setCleanupFinishedJobs(true);
        props.setWorkerId("test-worker");
        return props;
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
