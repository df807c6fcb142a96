package io.prayernotify.store.mongo;

import io.prayernotify.prayer.store.StoreReadException;
import io.prayernotify.prayer.store.SubscriptionStore;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Objects;

public class MongoSubscriptionStore implements SubscriptionStore {

    private final MongoTemplate mongoTemplate;

    public MongoSubscriptionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<String> findFollowedVenueIds(String subscriberId) {
        SubscriberDocument doc;
        try {
            doc = mongoTemplate.findById(subscriberId, SubscriberDocument.class);
        } catch (DataAccessException e) {
            throw new StoreReadException("Failed to read subscriber " + subscriberId, e);
        }
        if (doc == null || doc.getFollowingVenueIds() == null) {
            return List.of();
        }
        return List.copyOf(doc.getFollowingVenueIds());
    }
}
