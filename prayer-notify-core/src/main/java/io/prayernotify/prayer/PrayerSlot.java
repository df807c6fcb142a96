package io.prayernotify.prayer;

import java.time.Instant;
import java.util.Optional;

/**
 * Published times of one prayer on one day. Either instant may be absent.
 */
public record PrayerSlot(Instant primaryInstant, Instant secondaryInstant) {

    public Optional<Instant> primary() {
        return Optional.ofNullable(primaryInstant);
    }

    public Optional<Instant> secondary() {
        return Optional.ofNullable(secondaryInstant);
    }
}
