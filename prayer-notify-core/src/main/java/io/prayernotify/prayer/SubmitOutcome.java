package io.prayernotify.prayer;

/**
 * Result of handing one alert to the delayed task queue.
 */
public record SubmitOutcome(Status status, String key, Throwable error) {

    public enum Status {
        CREATED,
        /**
         * The queue already holds a task under this key. Counts as success.
         */
        ALREADY_EXISTS,
        FAILED
    }

    public static SubmitOutcome created(String key) {
        return new SubmitOutcome(Status.CREATED, key, null);
    }

    public static SubmitOutcome alreadyExists(String key) {
        return new SubmitOutcome(Status.ALREADY_EXISTS, key, null);
    }

    public static SubmitOutcome failed(String key, Throwable error) {
        return new SubmitOutcome(Status.FAILED, key, error);
    }

    public boolean isSuccess() {
        return status != Status.FAILED;
    }
}
