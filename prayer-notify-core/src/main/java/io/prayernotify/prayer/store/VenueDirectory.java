package io.prayernotify.prayer.store;

import io.prayernotify.prayer.Venue;

import java.util.List;
import java.util.Optional;

public interface VenueDirectory {

    List<Venue> findAll();

    Optional<Venue> findById(String venueId);
}
