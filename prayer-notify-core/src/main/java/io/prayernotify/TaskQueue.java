package io.prayernotify;

import io.prayernotify.core.PersistResult;

import java.time.Instant;

/**
 * Delayed task queue API.
 *
 * <p>Two kinds of jobs are supported:
 * <ul>
 *   <li>One-off jobs run at an absolute {@link Instant}. When a unique key is set, at most one job
 *   per {@code (name, uniqueKey)} is ever created; a second create reports
 *   {@link PersistResult#ALREADY_EXISTS} and leaves the stored job untouched.</li>
 *   <li>Recurring jobs (one per name) driven by a daily {@code AT HH:mm} rule or a cron expression.</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * queue.start();
 *
 * queue.create("prayer-notification", target)
 *      .uniqueKey(dedupKey)
 *      .schedule(fireInstant)
 *      .save();
 *
 * queue.every("prayer-daily-sweep", "AT 00:30", "Europe/London", null);
 * queue.stop();
 * }</pre>
 */
public interface TaskQueue {
    void start();

    void stop();

    <T> JobBuilder<T> create(String name, T data);

    /**
     * Start a one-off job definition at an absolute time.
     */
    <T> JobBuilder<T> schedule(String name, Instant time, T data);

    /**
     * Create or update the recurring job registered under {@code name}.
     *
     * @param rule     {@code AT HH:mm} or a 5/6 field cron expression
     * @param timezone IANA zone id the rule is evaluated in; null means system default
     */
    <T> PersistResult every(String name, String rule, String timezone, T data);
}
