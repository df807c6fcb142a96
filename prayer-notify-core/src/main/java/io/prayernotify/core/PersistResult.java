package io.prayernotify.core;

public enum PersistResult {
    CREATED,
    UPDATED,
    /**
     * A job with the same {@code (name, uniqueKey)} was already stored; nothing was written.
     */
    ALREADY_EXISTS
}
