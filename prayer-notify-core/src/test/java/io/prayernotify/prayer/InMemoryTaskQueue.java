package io.prayernotify.prayer;

import io.prayernotify.JobBuilder;
import io.prayernotify.TaskQueue;
import io.prayernotify.core.JobSpec;
import io.prayernotify.core.JobType;
import io.prayernotify.core.PersistResult;
import io.prayernotify.internal.SimpleJobBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Queue double with the same create-once semantics as the Mongo store.
 */
class InMemoryTaskQueue implements TaskQueue {

    private final Map<String, JobSpec<?>> jobs = new LinkedHashMap<>();

    @Override
    public void start() {
    }

    @Override
    public void stop() {
    }

    @Override
    public <T> JobBuilder<T> create(String name, T data) {
        return new SimpleJobBuilder<>(name, data, this::persist);
    }

    @Override
    public <T> JobBuilder<T> schedule(String name, Instant time, T data) {
        return create(name, data).schedule(time);
    }

    @Override
    public <T> PersistResult every(String name, String rule, String timezone, T data) {
        return create(name, data).timezone(timezone).repeat(rule).single().save();
    }

    synchronized <T> PersistResult persist(JobSpec<T> spec) {
        if (spec.type() == JobType.SINGLE) {
            return jobs.put(spec.name(), spec) == null ? PersistResult.CREATED : PersistResult.UPDATED;
        }
        if (spec.uniqueKey() == null) {
            jobs.put(spec.name() + "|" + UUID.randomUUID(), spec);
            return PersistResult.CREATED;
        }
        return jobs.putIfAbsent(spec.name() + "|" + spec.uniqueKey(), spec) == null
                ? PersistResult.CREATED
                : PersistResult.ALREADY_EXISTS;
    }

    synchronized List<JobSpec<?>> jobs() {
        return new ArrayList<>(jobs.values());
    }
}
