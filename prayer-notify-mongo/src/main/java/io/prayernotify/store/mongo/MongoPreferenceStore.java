package io.prayernotify.store.mongo;

import io.prayernotify.prayer.PrayerAlertSetting;
import io.prayernotify.prayer.Preference;
import io.prayernotify.prayer.store.PreferenceStore;
import io.prayernotify.prayer.store.StoreReadException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class MongoPreferenceStore implements PreferenceStore {

    private final MongoTemplate mongoTemplate;

    public MongoPreferenceStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<Preference> find(String subscriberId, String venueId) {
        Query q = new Query(Criteria.where("subscriberId").is(subscriberId).and("venueId").is(venueId));
        NotificationSettingsDocument doc;
        try {
            doc = mongoTemplate.findOne(q, NotificationSettingsDocument.class);
        } catch (DataAccessException e) {
            throw new StoreReadException(
                    "Failed to read notification settings subscriberId=" + subscriberId + " venueId=" + venueId, e);
        }
        if (doc == null) {
            return Optional.empty();
        }

        Map<String, PrayerAlertSetting> prayers = new LinkedHashMap<>();
        if (doc.getPrayerNotifications() != null) {
            doc.getPrayerNotifications().forEach((prayer, flags) -> prayers.put(prayer, toSetting(flags)));
        }
        return Optional.of(new Preference(subscriberId, venueId, prayers));
    }

    private static PrayerAlertSetting toSetting(NotificationSettingsDocument.Flags flags) {
        if (flags == null) {
            return PrayerAlertSetting.NONE;
        }
        return new PrayerAlertSetting(Boolean.TRUE.equals(flags.getStart()), Boolean.TRUE.equals(flags.getJamaat()));
    }
}
