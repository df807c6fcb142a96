package io.prayernotify.prayer.store;

import io.prayernotify.prayer.Subscriber;

import java.util.List;

/**
 * Subscribers and their current push addresses.
 */
public interface DeviceRegistry {

    /**
     * All known subscribers, including those without a push address.
     *
     * @throws StoreReadException when the backing store cannot be read
     */
    List<Subscriber> findAllSubscribers();
}
