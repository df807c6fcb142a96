package io.prayernotify.prayer;

/**
 * Which of a prayer's two published instants an alert belongs to.
 */
public enum AlertKind {
    /**
     * Alert at the prayer's start time.
     */
    PRIMARY("start"),
    /**
     * Alert ahead of the congregation (jamaat) time.
     */
    SECONDARY("jamaat");

    private final String wireName;

    AlertKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Stable name used in task keys and routing data.
     */
    public String wireName() {
        return wireName;
    }
}
