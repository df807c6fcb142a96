package io.prayernotify.prayer.store;

import io.prayernotify.prayer.ScheduleEntry;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Read access to published prayer timetables.
 */
public interface ScheduleStore {

    /**
     * @return the timetable, or empty when the venue has not published one for {@code date}
     * @throws StoreReadException when the backing store cannot be read
     */
    Optional<ScheduleEntry> find(String venueId, LocalDate date);
}
