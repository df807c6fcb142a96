package io.prayernotify;

/**
 * Executes fired jobs of one name.
 */
public interface JobHandler<T> {
    String name();

    /**
     * Type the persisted job data is converted into before {@link #execute(Object)}.
     */
    Class<T> dataClass();

    /**
     * Throwing marks the run as failed; the queue retries it with backoff.
     */
    void execute(T data) throws Exception;
}
