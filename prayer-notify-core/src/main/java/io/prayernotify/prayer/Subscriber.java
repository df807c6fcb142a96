package io.prayernotify.prayer;

import java.util.Objects;

/**
 * @param pushAddress current device token; null when the subscriber has none registered
 */
public record Subscriber(String id, String pushAddress) {

    public Subscriber {
        Objects.requireNonNull(id, "id must not be null");
    }

    public boolean hasPushAddress() {
        return pushAddress != null && !pushAddress.isBlank();
    }
}
