package io.prayernotify.prayer;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a day's timetable and a subscriber's preference into future alert instants.
 *
 * <p>All comparisons are between absolute instants. The civil zone only decides which day's
 * timetable is loaded and never takes part here.
 */
public class FireTimeResolver {

    /**
     * Secondary alerts fire this long before the congregation time.
     */
    public static final Duration SECONDARY_LEAD_TIME = Duration.ofMinutes(30);

    /**
     * Resolve every alert that is still in the future at {@code now}.
     *
     * <p>A prayer produces nothing when it is missing from either side, when the preference flag
     * is off, when the timetable has no instant for that kind, or when the computed instant is at
     * or before {@code now}. Instants are truncated to whole seconds first, the precision the
     * queue stores.
     */
    public List<FireTime> resolve(ScheduleEntry entry, Preference preference, Instant now) {
        Objects.requireNonNull(entry, "entry must not be null");
        Objects.requireNonNull(preference, "preference must not be null");
        Objects.requireNonNull(now, "now must not be null");

        List<FireTime> out = new ArrayList<>();
        for (Map.Entry<String, PrayerAlertSetting> e : preference.prayers().entrySet()) {
            String prayer = e.getKey();
            PrayerAlertSetting setting = e.getValue() == null ? PrayerAlertSetting.NONE : e.getValue();

            Optional<PrayerSlot> slot = entry.slot(prayer);
            if (slot.isEmpty()) {
                continue;
            }

            for (AlertKind kind : AlertKind.values()) {
                if (!setting.enabled(kind)) {
                    continue;
                }
                fireInstant(slot.get(), kind)
                        .filter(at -> at.isAfter(now))
                        .ifPresent(at -> out.add(new FireTime(prayer, kind, at)));
            }
        }
        return out;
    }

    static Optional<Instant> fireInstant(PrayerSlot slot, AlertKind kind) {
        Optional<Instant> at = switch (kind) {
            case PRIMARY -> slot.primary();
            case SECONDARY -> slot.secondary().map(s -> s.minus(SECONDARY_LEAD_TIME));
        };
        return at.map(i -> i.truncatedTo(ChronoUnit.SECONDS));
    }
}
