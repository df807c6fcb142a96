package io.prayernotify.store.mongo;

import io.prayernotify.prayer.Subscriber;
import io.prayernotify.prayer.store.DeviceRegistry;
import io.prayernotify.prayer.store.StoreReadException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;
import java.util.Objects;

public class MongoDeviceRegistry implements DeviceRegistry {

    private final MongoTemplate mongoTemplate;

    public MongoDeviceRegistry(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Subscriber> findAllSubscribers() {
        Query q = new Query();
        q.fields().include("_id").include("pushToken");
        try {
            return mongoTemplate.find(q, SubscriberDocument.class).stream()
                    .map(doc -> new Subscriber(doc.getId(), doc.getPushToken()))
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreReadException("Failed to list subscribers", e);
        }
    }
}
