package io.prayernotify.prayer.store;

/**
 * A read from one of the external stores failed. Callers skip the affected item.
 */
public class StoreReadException extends RuntimeException {

    public StoreReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
