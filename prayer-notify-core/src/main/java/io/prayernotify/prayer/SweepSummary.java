package io.prayernotify.prayer;

/**
 * Counters collected during one sweep, for logging and trigger responses.
 *
 * @param created          tasks newly created in the queue
 * @param alreadyScheduled alerts whose task already existed
 * @param failed           task submissions or store reads that failed
 * @param skipped          subscriber/venue pairs skipped for missing data
 */
public record SweepSummary(int created, int alreadyScheduled, int failed, int skipped) {

    public static SweepSummary empty() {
        return new SweepSummary(0, 0, 0, 0);
    }
}
