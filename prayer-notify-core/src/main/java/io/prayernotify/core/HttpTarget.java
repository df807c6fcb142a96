package io.prayernotify.core;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP request a queued job issues when it fires.
 *
 * @param method  HTTP method, e.g. {@code POST}
 * @param url     absolute target url
 * @param headers request headers
 * @param body    base64-encoded request body
 */
public record HttpTarget(
        String method,
        String url,
        Map<String, String> headers,
        String body
) {
    public HttpTarget {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(url, "url must not be null");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpTarget postJson(String url, String json) {
        return new HttpTarget(
                "POST",
                url,
                Map.of("Content-Type", "application/json"),
                Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8))
        );
    }

    public byte[] decodedBody() {
        return body == null ? new byte[0] : Base64.getDecoder().decode(body);
    }
}
