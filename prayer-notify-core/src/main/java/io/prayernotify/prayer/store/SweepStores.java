package io.prayernotify.prayer.store;

import java.util.Objects;

/**
 * The read-only collaborators a sweep needs.
 */
public record SweepStores(
        VenueDirectory venues,
        ScheduleStore schedules,
        PreferenceStore preferences,
        DeviceRegistry devices,
        SubscriptionStore subscriptions
) {
    public SweepStores {
        Objects.requireNonNull(venues, "venues must not be null");
        Objects.requireNonNull(schedules, "schedules must not be null");
        Objects.requireNonNull(preferences, "preferences must not be null");
        Objects.requireNonNull(devices, "devices must not be null");
        Objects.requireNonNull(subscriptions, "subscriptions must not be null");
    }
}
