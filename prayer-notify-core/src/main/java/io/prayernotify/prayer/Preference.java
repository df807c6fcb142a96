package io.prayernotify.prayer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A subscriber's per-prayer alert choices for one venue.
 */
public record Preference(String subscriberId, String venueId, Map<String, PrayerAlertSetting> prayers) {

    public Preference {
        Objects.requireNonNull(subscriberId, "subscriberId must not be null");
        Objects.requireNonNull(venueId, "venueId must not be null");
        prayers = prayers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(prayers));
    }
}
