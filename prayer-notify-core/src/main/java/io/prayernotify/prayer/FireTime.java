package io.prayernotify.prayer;

import java.time.Instant;

/**
 * One alert that should be delivered at {@code fireInstant}.
 */
public record FireTime(String eventName, AlertKind alertKind, Instant fireInstant) {
}
