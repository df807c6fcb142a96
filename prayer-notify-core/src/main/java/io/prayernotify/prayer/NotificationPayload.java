package io.prayernotify.prayer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body the dispatch endpoint receives when a queued alert fires.
 */
public record NotificationPayload(
        String pushAddress,
        String title,
        String body,
        Map<String, String> routingData
) {
    public NotificationPayload {
        routingData = routingData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(routingData));
    }
}
