package io.prayernotify;

import io.prayernotify.core.JobSpec;
import io.prayernotify.core.PersistResult;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + hand the spec to the queue store</li>
 * </ul>
 */
public interface JobBuilder<T> {

    /**
     * Deterministic unique key. A job carrying one is created at most once.
     */
    JobBuilder<T> uniqueKey(String uniqueKey);

    /**
     * Set the timezone recurring rules are evaluated in. Null means system default.
     */
    JobBuilder<T> timezone(String timezone);

    /**
     * Schedule a one-time run at the specified absolute time.
     */
    JobBuilder<T> schedule(Instant time);

    /**
     * Repeat by {@code AT HH:mm} or cron rule. The first run is the next occurrence after now
     * unless {@link #schedule(Instant)} was already called.
     */
    JobBuilder<T> repeat(String rule);

    /**
     * Mark this job as 'single': one document per name, updated in place on every save.
     */
    JobBuilder<T> single();

    JobSpec<T> build();

    PersistResult save();
}
