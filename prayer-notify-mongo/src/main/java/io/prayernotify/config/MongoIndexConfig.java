package io.prayernotify.config;

import io.prayernotify.internal.mongo.ScheduledJobDocument;
import io.prayernotify.store.mongo.NotificationSettingsDocument;
import io.prayernotify.store.mongo.PrayerTimesDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

import java.util.Objects;

/**
 * MongoDB index definitions.
 *
 * <p>Indexes are not created implicitly. Call {@link #ensureIndexes()} (or set
 * {@code prayer.queue.ensure-indexes-on-startup=true}) in environments where the application owns
 * its schema; elsewhere create them with the equivalent mongosh script.
 *
 * <h3>scheduled_jobs</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { nextRunAt: 1, lockUntil: 1 }
 *       <br/>Used by the poller to claim due jobs.</li>
 *   <li><b>ux_name_uniqueKey</b> (unique + partial): { name: 1, uniqueKey: 1 } with
 *       partialFilterExpression { type: "NORMAL", uniqueKey: { $exists: true } }
 *       <br/>Guarantees that a keyed job is created at most once.</li>
 *   <li><b>ux_single_name</b> (unique + partial): { name: 1 } with partialFilterExpression { type: "SINGLE" }</li>
 * </ul>
 *
 * <h3>prayer_times / notification_settings</h3>
 * <ul>
 *   <li><b>idx_venue_date</b>: { venueId: 1, date: 1 }</li>
 *   <li><b>idx_subscriber_venue</b>: { subscriberId: 1, venueId: 1 }</li>
 * </ul>
 *
 * <pre>
 * db.scheduled_jobs.createIndex({ nextRunAt: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.scheduled_jobs.createIndex(
 *   { name: 1, uniqueKey: 1 },
 *   { name: "ux_name_uniqueKey", unique: true,
 *     partialFilterExpression: { type: "NORMAL", uniqueKey: { $exists: true } } }
 * );
 * db.scheduled_jobs.createIndex(
 *   { name: 1 },
 *   { name: "ux_single_name", unique: true, partialFilterExpression: { type: "SINGLE" } }
 * );
 * db.prayer_times.createIndex({ venueId: 1, date: 1 }, { name: "idx_venue_date" });
 * db.notification_settings.createIndex({ subscriberId: 1, venueId: 1 }, { name: "idx_subscriber_venue" });
 * </pre>
 */
public class MongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String UX_NAME_UNIQUE_KEY = "ux_name_uniqueKey";
    public static final String UX_SINGLE_NAME = "ux_single_name";
    public static final String IDX_VENUE_DATE = "idx_venue_date";
    public static final String IDX_SUBSCRIBER_VENUE = "idx_subscriber_venue";

    private final MongoTemplate mongoTemplate;

    public MongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(dueClaimIndex());
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(nameUniqueKeyIndex());
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(singleNameUniqueIndex());
        mongoTemplate.indexOps(PrayerTimesDocument.class).ensureIndex(venueDateIndex());
        mongoTemplate.indexOps(NotificationSettingsDocument.class).ensureIndex(subscriberVenueIndex());
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index nameUniqueKeyIndex() {
        Document filter = new Document("type", "NORMAL")
                .append("uniqueKey", new Document("$exists", true));
        return new Index()
                .on("name", Sort.Direction.ASC)
                .on("uniqueKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(filter))
                .named(UX_NAME_UNIQUE_KEY);
    }

    public static Index singleNameUniqueIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("type", "SINGLE")))
                .named(UX_SINGLE_NAME);
    }

    public static Index venueDateIndex() {
        return new Index()
                .on("venueId", Sort.Direction.ASC)
                .on("date", Sort.Direction.ASC)
                .named(IDX_VENUE_DATE);
    }

    public static Index subscriberVenueIndex() {
        return new Index()
                .on("subscriberId", Sort.Direction.ASC)
                .on("venueId", Sort.Direction.ASC)
                .named(IDX_SUBSCRIBER_VENUE);
    }
}
