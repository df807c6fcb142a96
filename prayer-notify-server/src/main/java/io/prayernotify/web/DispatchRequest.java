package io.prayernotify.web;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.prayernotify.prayer.NotificationPayload;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of the dispatch endpoints. {@code token} and {@code data} are accepted as aliases for
 * direct-send callers.
 */
public record DispatchRequest(
        @NotBlank @JsonAlias("token") String pushAddress,
        @NotBlank String title,
        @NotBlank String body,
        @JsonAlias("data") Map<String, String> routingData
) {

    public NotificationPayload toPayload() {
        return new NotificationPayload(pushAddress, title, body, routingData == null ? Map.of() : routingData);
    }
}
