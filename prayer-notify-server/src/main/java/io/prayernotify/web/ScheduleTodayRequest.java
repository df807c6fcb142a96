package io.prayernotify.web;

/**
 * @param token the caller's current push token
 */
public record ScheduleTodayRequest(String token) {
}
