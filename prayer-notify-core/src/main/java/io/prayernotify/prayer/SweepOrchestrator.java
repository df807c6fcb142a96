package io.prayernotify.prayer;

import io.prayernotify.prayer.store.SweepStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the resolve, derive key, submit pipeline over (subscriber, venue) pairs.
 *
 * <p>Two scopes:
 * <ul>
 *   <li>{@link #runGlobalSweep()}: every venue with a timetable today × every subscriber with a
 *   push address and a preference for that venue (daily job and manual trigger)</li>
 *   <li>{@link #runTargetedSweep(String, String)}: the venues one subscriber follows (re-sync
 *   after sign-in)</li>
 * </ul>
 *
 * <p>Failures are isolated per item: they are logged and counted, and the loop moves on. No
 * locking is done here. Concurrent or repeated sweeps are safe because every path derives the
 * same task key and the queue creates each key at most once.
 */
public class SweepOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SweepOrchestrator.class);

    private final SweepStores stores;
    private final FireTimeResolver resolver;
    private final DedupKeyDeriver keyDeriver;
    private final NotificationTextFormatter formatter;
    private final NotificationTaskScheduler scheduler;
    private final Clock clock;
    private final ZoneId zone;

    public SweepOrchestrator(SweepStores stores,
                             FireTimeResolver resolver,
                             DedupKeyDeriver keyDeriver,
                             NotificationTextFormatter formatter,
                             NotificationTaskScheduler scheduler,
                             Clock clock,
                             ZoneId zone) {
        this.stores = Objects.requireNonNull(stores, "stores must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.keyDeriver = Objects.requireNonNull(keyDeriver, "keyDeriver must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public SweepSummary runGlobalSweep() {
        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, zone);
        Tally tally = new Tally();

        log.info("Prayer sweep (global) starting day={} now={}", day, now);

        List<Venue> venues;
        try {
            venues = stores.venues().findAll();
        } catch (RuntimeException e) {
            log.error("Prayer sweep (global) could not list venues msg={}", e.getMessage(), e);
            tally.failed++;
            return finish("global", tally);
        }

        List<Subscriber> subscribers = null;
        for (Venue venue : venues) {
            try {
                Optional<ScheduleEntry> entry = stores.schedules().find(venue.id(), day);
                if (entry.isEmpty()) {
                    log.debug("No timetable venueId={} day={}", venue.id(), day);
                    continue;
                }
                if (subscribers == null) {
                    subscribers = stores.devices().findAllSubscribers();
                }
                for (Subscriber subscriber : subscribers) {
                    if (!subscriber.hasPushAddress()) {
                        tally.skipped++;
                        continue;
                    }
                    schedulePair(subscriber.id(), subscriber.pushAddress(), venue, entry.get(), now, tally);
                }
            } catch (RuntimeException e) {
                tally.failed++;
                log.warn("Prayer sweep (global) skipped venueId={} msg={}", venue.id(), e.getMessage(), e);
            }
        }

        return finish("global", tally);
    }

    public SweepSummary runTargetedSweep(String subscriberId, String pushAddress) {
        Objects.requireNonNull(subscriberId, "subscriberId must not be null");
        Tally tally = new Tally();
        if (pushAddress == null || pushAddress.isBlank()) {
            log.debug("Prayer sweep (targeted) has no push address subscriberId={}", subscriberId);
            tally.skipped++;
            return tally.summary();
        }

        Instant now = clock.instant();
        LocalDate day = LocalDate.ofInstant(now, zone);
        log.info("Prayer sweep (targeted) starting subscriberId={} day={} now={}", subscriberId, day, now);

        List<String> venueIds;
        try {
            venueIds = stores.subscriptions().findFollowedVenueIds(subscriberId);
        } catch (RuntimeException e) {
            log.error("Prayer sweep (targeted) could not list followed venues subscriberId={} msg={}",
                    subscriberId, e.getMessage(), e);
            tally.failed++;
            return finish("targeted", tally);
        }

        for (String venueId : venueIds) {
            try {
                Optional<ScheduleEntry> entry = stores.schedules().find(venueId, day);
                if (entry.isEmpty()) {
                    log.debug("No timetable venueId={} day={}", venueId, day);
                    tally.skipped++;
                    continue;
                }
                Venue venue = stores.venues().findById(venueId).orElseGet(() -> new Venue(venueId, null));
                schedulePair(subscriberId, pushAddress, venue, entry.get(), now, tally);
            } catch (RuntimeException e) {
                tally.failed++;
                log.warn("Prayer sweep (targeted) skipped subscriberId={} venueId={} msg={}",
                        subscriberId, venueId, e.getMessage(), e);
            }
        }

        return finish("targeted", tally);
    }

    private void schedulePair(String subscriberId,
                              String pushAddress,
                              Venue venue,
                              ScheduleEntry entry,
                              Instant now,
                              Tally tally) {
        try {
            Optional<Preference> preference = stores.preferences().find(subscriberId, venue.id());
            if (preference.isEmpty()) {
                tally.skipped++;
                return;
            }

            for (FireTime fireTime : resolver.resolve(entry, preference.get(), now)) {
                String key = keyDeriver.deriveKey(
                        pushAddress,
                        venue.id(),
                        fireTime.eventName(),
                        fireTime.alertKind(),
                        fireTime.fireInstant()
                );
                NotificationPayload payload = formatter.compose(pushAddress, venue, fireTime);
                tally.record(scheduler.submit(key, payload, fireTime.fireInstant()));
            }
        } catch (RuntimeException e) {
            tally.failed++;
            log.warn("Prayer sweep skipped subscriberId={} venueId={} msg={}",
                    subscriberId, venue.id(), e.getMessage(), e);
        }
    }

    private static SweepSummary finish(String scope, Tally tally) {
        SweepSummary summary = tally.summary();
        log.info("Prayer sweep ({}) completed created={} alreadyScheduled={} failed={} skipped={}",
                scope, summary.created(), summary.alreadyScheduled(), summary.failed(), summary.skipped());
        return summary;
    }

    private static final class Tally {
        private int created;
        private int alreadyScheduled;
        private int failed;
        private int skipped;

        void record(SubmitOutcome outcome) {
            switch (outcome.status()) {
                case CREATED -> created++;
                case ALREADY_EXISTS -> alreadyScheduled++;
                case FAILED -> failed++;
            }
        }

        SweepSummary summary() {
            return new SweepSummary(created, alreadyScheduled, failed, skipped);
        }
    }
}
