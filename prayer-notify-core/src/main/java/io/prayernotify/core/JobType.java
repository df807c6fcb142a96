package io.prayernotify.core;

public enum JobType {
    /**
     * One document per job name; saving again updates it.
     */
    SINGLE,
    /**
     * Many documents per name; with a unique key, insert-only.
     */
    NORMAL
}
