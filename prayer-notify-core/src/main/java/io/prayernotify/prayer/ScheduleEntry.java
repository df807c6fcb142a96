package io.prayernotify.prayer;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A venue's published prayer timetable for one calendar date, keyed by prayer name.
 */
public record ScheduleEntry(String venueId, LocalDate date, Map<String, PrayerSlot> prayers) {

    public ScheduleEntry {
        Objects.requireNonNull(venueId, "venueId must not be null");
        Objects.requireNonNull(date, "date must not be null");
        prayers = prayers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prayers));
    }

    public Optional<PrayerSlot> slot(String prayer) {
        return Optional.ofNullable(prayers.get(prayer));
    }
}
