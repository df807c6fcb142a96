package io.prayernotify.prayer.store;

import io.prayernotify.prayer.Preference;

import java.util.Optional;

public interface PreferenceStore {

    /**
     * @throws StoreReadException when the backing store cannot be read
     */
    Optional<Preference> find(String subscriberId, String venueId);
}
