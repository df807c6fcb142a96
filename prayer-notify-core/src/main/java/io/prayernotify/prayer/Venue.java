package io.prayernotify.prayer;

import java.util.Objects;

public record Venue(String id, String name) {

    public Venue {
        Objects.requireNonNull(id, "id must not be null");
    }
}
