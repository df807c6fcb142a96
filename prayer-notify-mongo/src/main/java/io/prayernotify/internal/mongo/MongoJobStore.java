package io.prayernotify.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.prayernotify.core.JobSpec;
import io.prayernotify.core.JobType;
import io.prayernotify.core.PersistResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB persistence layer for queued jobs.
 *
 * <p>Semantics per job type:
 * <ul>
 *   <li>type=SINGLE: one job per name, upserted (recurring jobs such as the daily sweep)</li>
 *   <li>type=NORMAL with a uniqueKey: created at most once per {name, uniqueKey}; a later save
 *   with the same key is reported as {@link PersistResult#ALREADY_EXISTS} and changes nothing</li>
 *   <li>type=NORMAL without a uniqueKey: plain insert</li>
 * </ul>
 */
public class MongoJobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    public static final String COLLECTION = "scheduled_jobs";

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Persist a job spec.
     */
    public <T> PersistResult save(JobSpec<T> spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        if (spec.type() == JobType.SINGLE) {
            return upsertSingle(spec);
        }
        if (isBlank(spec.uniqueKey())) {
            mongoTemplate.insert(toDocument(spec));
            return PersistResult.CREATED;
        }
        return createIfAbsent(spec);
    }

    private <T> PersistResult upsertSingle(JobSpec<T> spec) {
        Query query = new Query(Criteria.where("name").is(spec.name()).and("type").is(JobType.SINGLE));

        Update u = new Update()
                .set("name", spec.name())
                .set("type", spec.type())
                .set("nextRunAt", spec.nextRunAt())
                .setOnInsert("createdAt", clock.instant())
                .unset("uniqueKey");

        setOrUnset(u, "repeatRule", spec.repeatRule());
        setOrUnset(u, "repeatTimezone", spec.repeatTimezone());

        Map<String, Object> dataMap = toDataMap(spec.data());
        if (dataMap != null) {
            u.set("data", dataMap);
        } else {
            u.unset("data");
        }

        UpdateResult result = mongoTemplate.upsert(query, u, ScheduledJobDocument.class);
        return result.getUpsertedId() != null ? PersistResult.CREATED : PersistResult.UPDATED;
    }

    /**
     * Insert-only upsert: every field goes through {@code $setOnInsert}, so a matching document is
     * never modified. Two racing writers either match the same document or one of them trips the
     * unique index; both outcomes are reported as {@link PersistResult#ALREADY_EXISTS}.
     */
    private <T> PersistResult createIfAbsent(JobSpec<T> spec) {
        Query query = new Query(Criteria.where("name").is(spec.name())
                .and("type").is(JobType.NORMAL)
                .and("uniqueKey").is(spec.uniqueKey()));

        Update u = new Update()
                .setOnInsert("name", spec.name())
                .setOnInsert("type", spec.type())
                .setOnInsert("uniqueKey", spec.uniqueKey())
                .setOnInsert("nextRunAt", spec.nextRunAt())
                .setOnInsert("createdAt", clock.instant())
                .setOnInsert("failCount", 0);

        if (!isBlank(spec.repeatRule())) {
            u.setOnInsert("repeatRule", spec.repeatRule());
        }
        if (!isBlank(spec.repeatTimezone())) {
            u.setOnInsert("repeatTimezone", spec.repeatTimezone());
        }
        Map<String, Object> dataMap = toDataMap(spec.data());
        if (dataMap != null) {
            u.setOnInsert("data", dataMap);
        }

        try {
            UpdateResult result = mongoTemplate.upsert(query, u, ScheduledJobDocument.class);
            return result.getUpsertedId() != null ? PersistResult.CREATED : PersistResult.ALREADY_EXISTS;
        } catch (DuplicateKeyException e) {
            log.debug("Job already exists name={} uniqueKey={}", spec.name(), spec.uniqueKey());
            return PersistResult.ALREADY_EXISTS;
        }
    }

    private <T> ScheduledJobDocument toDocument(JobSpec<T> spec) {
        ScheduledJobDocument doc = new ScheduledJobDocument();
        doc.setName(spec.name());
        doc.setType(spec.type());
        doc.setUniqueKey(spec.uniqueKey());
        doc.setNextRunAt(spec.nextRunAt());
        doc.setRepeatRule(spec.repeatRule());
        doc.setRepeatTimezone(spec.repeatTimezone());
        doc.setCreatedAt(clock.instant());
        doc.setData(toDataMap(spec.data()));
        return doc;
    }

    private Map<String, Object> toDataMap(Object data) {
        if (data == null) {
            return null;
        }
        return objectMapper.convertValue(data, new TypeReference<>() {
        });
    }

    /**
     * Converts a persisted document back into a {@link JobSpec}; {@code data} is converted into
     * {@code dataClass}, or left null when {@code dataClass} is null.
     */
    public <T> JobSpec<T> toSpec(ScheduledJobDocument doc, Class<T> dataClass) {
        Objects.requireNonNull(doc, "doc must not be null");

        Map<String, Object> raw = doc.getData();
        T data = null;
        if (raw != null && dataClass != null) {
            data = objectMapper.convertValue(raw, dataClass);
        }

        return new JobSpec<>(
                doc.getName(),
                doc.getUniqueKey(),
                doc.getType(),
                doc.getNextRunAt(),
                doc.getRepeatRule(),
                doc.getRepeatTimezone(),
                data
        );
    }

    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, ScheduledJobDocument.class).getDeletedCount();
    }

    public ScheduledJobDocument findSingleByName(String name) {
        Query q = new Query(Criteria.where("name").is(name).and("type").is(JobType.SINGLE));
        return mongoTemplate.findOne(q, ScheduledJobDocument.class);
    }

    public ScheduledJobDocument findByNameAndUniqueKey(String name, String uniqueKey) {
        Query q = new Query(Criteria.where("name").is(name)
                .and("type").is(JobType.NORMAL)
                .and("uniqueKey").is(uniqueKey));
        return mongoTemplate.findOne(q, ScheduledJobDocument.class);
    }

    /**
     * Atomically claims (locks) at most {@code batchSize} due jobs.
     *
     * <p>A job is due when {@code nextRunAt <= windowEnd} and it is not locked or its lock has
     * expired. Each claim is a single {@code findAndModify}, so competing workers never claim the
     * same job twice.
     */
    public List<ScheduledJobDocument> claimDueJobs(Instant windowEnd, int batchSize, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Instant now = clock.instant();
        Instant lockUntil = now.plus(lockLifetime);

        Query baseQuery = new Query(
                Criteria.where("nextRunAt").ne(null).lte(windowEnd)
                        .andOperator(
                                new Criteria().orOperator(
                                        Criteria.where("lockUntil").is(null),
                                        Criteria.where("lockUntil").lte(now)
                                )
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("nextRunAt")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", lockUntil)
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<ScheduledJobDocument> claimed = new ArrayList<>(Math.min(batchSize, 64));
        for (int i = 0; i < batchSize; i++) {
            ScheduledJobDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, ScheduledJobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(doc);
        }
        return claimed;
    }

    public UpdateResult markSuccess(String id, String workerId, Instant startedAt, Instant finishedAt, Instant nextRunAtOrNull) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        // another worker may have re-claimed after our lock expired
                        .and("lockedBy").is(workerId)
        );

        Update u = new Update()
                .set("lastRunAt", startedAt != null ? startedAt : finishedAt)
                .set("lastFinishedAt", finishedAt)
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy")
                .unset("failedAt")
                .unset("failReason")
                .set("failCount", 0);

        if (nextRunAtOrNull != null) {
            u.set("nextRunAt", nextRunAtOrNull);
        } else {
            u.unset("nextRunAt");
        }

        return mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class);
    }

    public UpdateResult markFailure(String id, String workerId, Instant failedAt, String reason, Instant nextRunAtOrNull) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(failedAt, "failedAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .and("lockedBy").is(workerId)
        );

        Update u = new Update()
                .inc("failCount", 1)
                .set("failedAt", failedAt)
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        setOrUnset(u, "failReason", reason);

        if (nextRunAtOrNull != null) {
            u.set("nextRunAt", nextRunAtOrNull);
        } else {
            u.unset("nextRunAt");
        }

        return mongoTemplate.updateFirst(q, u, ScheduledJobDocument.class);
    }

    private static void setOrUnset(Update u, String field, String value) {
        if (!isBlank(value)) {
            u.set(field, value);
        } else {
            u.unset(field);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
