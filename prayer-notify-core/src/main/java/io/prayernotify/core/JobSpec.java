package io.prayernotify.core;

import java.time.Instant;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec<T>(

        // identity
        String name,
        String uniqueKey,
        JobType type,

        // scheduling
        Instant nextRunAt,
        String repeatRule,
        String repeatTimezone,

        // payload
        T data
) {
}
