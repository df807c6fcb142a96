package io.prayernotify.store.mongo;

import io.prayernotify.prayer.Venue;
import io.prayernotify.prayer.store.StoreReadException;
import io.prayernotify.prayer.store.VenueDirectory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class MongoVenueDirectory implements VenueDirectory {

    private final MongoTemplate mongoTemplate;

    public MongoVenueDirectory(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<Venue> findAll() {
        try {
            return mongoTemplate.findAll(VenueDocument.class).stream()
                    .map(MongoVenueDirectory::toVenue)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreReadException("Failed to list venues", e);
        }
    }

    @Override
    public Optional<Venue> findById(String venueId) {
        try {
            return Optional.ofNullable(mongoTemplate.findById(venueId, VenueDocument.class))
                    .map(MongoVenueDirectory::toVenue);
        } catch (DataAccessException e) {
            throw new StoreReadException("Failed to read venue " + venueId, e);
        }
    }

    private static Venue toVenue(VenueDocument doc) {
        return new Venue(doc.getId(), doc.getName());
    }
}
