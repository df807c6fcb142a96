package io.prayernotify.store.mongo;

import io.prayernotify.prayer.PrayerSlot;
import io.prayernotify.prayer.ScheduleEntry;
import io.prayernotify.prayer.store.ScheduleStore;
import io.prayernotify.prayer.store.StoreReadException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code prayer_times}, one document per venue and civil date.
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<ScheduleEntry> find(String venueId, LocalDate date) {
        Query q = new Query(Criteria.where("venueId").is(venueId)
                .and("date").is(date.format(DateTimeFormatter.ISO_LOCAL_DATE)));
        PrayerTimesDocument doc;
        try {
            doc = mongoTemplate.findOne(q, PrayerTimesDocument.class);
        } catch (DataAccessException e) {
            throw new StoreReadException("Failed to read timetable venueId=" + venueId + " date=" + date, e);
        }
        if (doc == null) {
            return Optional.empty();
        }

        Map<String, PrayerSlot> prayers = new LinkedHashMap<>();
        if (doc.getPrayers() != null) {
            doc.getPrayers().forEach((prayer, slot) -> {
                if (slot != null) {
                    prayers.put(prayer, new PrayerSlot(slot.getStart(), slot.getJamaat()));
                }
            });
        }
        return Optional.of(new ScheduleEntry(venueId, date, prayers));
    }
}
