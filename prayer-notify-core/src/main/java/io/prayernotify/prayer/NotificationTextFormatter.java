package io.prayernotify.prayer;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the user-facing text and routing data for a prayer alert.
 */
public class NotificationTextFormatter {

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("HH:mm", Locale.UK);

    private final ZoneId zone;
    private final String defaultVenueName;

    public NotificationTextFormatter(ZoneId zone, String defaultVenueName) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.defaultVenueName = Objects.requireNonNull(defaultVenueName, "defaultVenueName must not be null");
    }

    public NotificationPayload compose(String pushAddress, Venue venue, FireTime fireTime) {
        String venueName = title(venue);
        Map<String, String> routing = new LinkedHashMap<>();
        routing.put("type", DedupKeyDeriver.EVENT_KIND);
        routing.put("prayer", fireTime.eventName());
        routing.put("timeType", fireTime.alertKind().wireName());
        routing.put("venueName", venueName);
        routing.put("venueId", venue.id());
        return new NotificationPayload(pushAddress, venueName, body(fireTime), routing);
    }

    public String title(Venue venue) {
        String name = venue.name();
        return name == null || name.isBlank() ? defaultVenueName : name;
    }

    public String body(FireTime fireTime) {
        String prayer = capitalize(fireTime.eventName());
        return switch (fireTime.alertKind()) {
            case PRIMARY -> prayer + " at " + HOUR_MINUTE.format(fireTime.fireInstant().atZone(zone));
            case SECONDARY -> prayer + " Jamaat in " + FireTimeResolver.SECONDARY_LEAD_TIME.toMinutes() + " mins";
        };
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }
}
