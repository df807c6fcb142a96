package io.prayernotify.internal;

import io.prayernotify.JobBuilder;
import io.prayernotify.core.JobSpec;
import io.prayernotify.core.JobType;
import io.prayernotify.core.PersistResult;
import io.prayernotify.utils.RecurrenceRules;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation; persistence is delegated to the queue's store.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final String name;
    private final T data;
    private final Function<JobSpec<T>, PersistResult> persister;
    private final Clock clock;

    private String uniqueKey;
    private JobType type = JobType.NORMAL;

    private Instant nextRunAt;
    private String repeatRule;
    private String repeatTimezone;

    public SimpleJobBuilder(String name, T data, Function<JobSpec<T>, PersistResult> persister) {
        this(name, data, persister, Clock.systemUTC());
    }

    public SimpleJobBuilder(String name, T data, Function<JobSpec<T>, PersistResult> persister, Clock clock) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) throw new IllegalArgumentException("job name must not be blank");
        this.data = data;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobBuilder<T> uniqueKey(String uniqueKey) {
        Objects.requireNonNull(uniqueKey, "uniqueKey must not be null");
        if (uniqueKey.isBlank()) throw new IllegalArgumentException("uniqueKey must not be blank");

        this.uniqueKey = uniqueKey;
        this.type = JobType.NORMAL;
        return this;
    }

    @Override
    public JobBuilder<T> timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ZoneId.of(timezone);
        this.repeatTimezone = timezone;
        return this;
    }

    @Override
    public JobBuilder<T> schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        // the queue works in whole seconds
        this.nextRunAt = time.truncatedTo(ChronoUnit.SECONDS);
        return this;
    }

    @Override
    public JobBuilder<T> repeat(String rule) {
        RecurrenceRules.validate(rule);
        this.repeatRule = rule.trim();
        if (this.repeatTimezone == null) {
            this.repeatTimezone = ZoneId.systemDefault().getId();
        }
        if (this.nextRunAt == null) {
            this.nextRunAt = RecurrenceRules.nextOccurrence(repeatRule, repeatTimezone, clock.instant());
        }
        return this;
    }

    @Override
    public JobBuilder<T> single() {
        this.uniqueKey = null;
        this.type = JobType.SINGLE;
        return this;
    }

    @Override
    public JobSpec<T> build() {
        if (nextRunAt == null) {
            throw new IllegalStateException("job '" + name + "' has neither a schedule nor a repeat rule");
        }
        return new JobSpec<>(
                name,
                uniqueKey,
                type,
                nextRunAt,
                repeatRule,
                repeatTimezone,
                data
        );
    }

    @Override
    public PersistResult save() {
        return persister.apply(build());
    }
}
