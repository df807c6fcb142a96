package io.prayernotify.prayer.store;

import java.util.List;

public interface SubscriptionStore {

    /**
     * Ids of the venues a subscriber follows.
     *
     * @throws StoreReadException when the backing store cannot be read
     */
    List<String> findFollowedVenueIds(String subscriberId);
}
