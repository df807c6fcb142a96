package io.prayernotify.prayer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives the queue-visible unique name of one logical alert.
 *
 * <p>Layout: {@code prayer_<event>_<start|jamaat>_<venueId>_<sha256(pushAddress)>_<epochSeconds>}.
 * The push address only appears hashed. Free-text parts are escaped ({@code [A-Za-z0-9]} kept,
 * anything else written as {@code -xxxx}) so that the result is injective and only contains
 * {@code [A-Za-z0-9_-]}.
 *
 * <p>Every trigger path must go through this class; the queue's at-most-once guarantee is only as
 * good as the stability of these names.
 */
public final class DedupKeyDeriver {

    static final String EVENT_KIND = "prayer";
    private static final char SEPARATOR = '_';
    private static final HexFormat HEX = HexFormat.of();

    public String deriveKey(String pushAddress, String venueId, String eventName, AlertKind alertKind, Instant fireInstant) {
        Objects.requireNonNull(pushAddress, "pushAddress must not be null");
        Objects.requireNonNull(venueId, "venueId must not be null");
        Objects.requireNonNull(eventName, "eventName must not be null");
        Objects.requireNonNull(alertKind, "alertKind must not be null");
        Objects.requireNonNull(fireInstant, "fireInstant must not be null");

        return new StringBuilder(160)
                .append(EVENT_KIND).append(SEPARATOR)
                .append(escape(eventName)).append(SEPARATOR)
                .append(alertKind.wireName()).append(SEPARATOR)
                .append(escape(venueId)).append(SEPARATOR)
                .append(hashPushAddress(pushAddress)).append(SEPARATOR)
                .append(fireInstant.getEpochSecond())
                .toString();
    }

    static String hashPushAddress(String pushAddress) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(pushAddress.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            } else {
                sb.append('-').append(HEX.toHexDigits(c));
            }
        }
        return sb.toString();
    }
}
