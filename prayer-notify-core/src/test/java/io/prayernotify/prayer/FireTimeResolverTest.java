package io.prayernotify.prayer;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class FireTimeResolverTest {

    private final FireTimeResolver resolver = new FireTimeResolver();

    private static ScheduleEntry january15() {
        Map<String, PrayerSlot> prayers = new LinkedHashMap<>();
        prayers.put("fajr", new PrayerSlot(Instant.parse("2026-01-15T06:00:00Z"), Instant.parse("2026-01-15T06:30:00Z")));
        prayers.put("dhuhr", new PrayerSlot(Instant.parse("2026-01-15T12:15:00Z"), Instant.parse("2026-01-15T12:45:00Z")));
        prayers.put("asr", new PrayerSlot(Instant.parse("2026-01-15T14:10:00Z"), null));
        return new ScheduleEntry("m1", LocalDate.of(2026, 1, 15), prayers);
    }

    @Test
    void shouldEmitPrimaryAndSecondaryAlertsInTheFuture() {
        Preference pref = new Preference("u1", "m1", Map.of("fajr", new PrayerAlertSetting(true, true)));

        List<FireTime> out = resolver.resolve(january15(), pref, Instant.parse("2026-01-15T05:00:00Z"));

        assertThat(out)
                .extracting(FireTime::eventName, FireTime::alertKind, FireTime::fireInstant)
                .containsExactlyInAnyOrder(
                        tuple("fajr", AlertKind.PRIMARY, Instant.parse("2026-01-15T06:00:00Z")),
                        tuple("fajr", AlertKind.SECONDARY, Instant.parse("2026-01-15T06:00:00Z"))
                );
    }

    @Test
    void alertsAtOrBeforeNowShouldBeDropped() {
        Map<String, PrayerAlertSetting> settings = new LinkedHashMap<>();
        settings.put("fajr", new PrayerAlertSetting(true, true));
        settings.put("dhuhr", new PrayerAlertSetting(true, true));
        Preference pref = new Preference("u1", "m1", settings);

        List<FireTime> out = resolver.resolve(january15(), pref, Instant.parse("2026-01-15T12:15:00Z"));

        // dhuhr start and its jamaat lead both land exactly on now
        assertThat(out).isEmpty();

        List<FireTime> oneSecondEarlier = resolver.resolve(january15(), pref, Instant.parse("2026-01-15T12:14:59Z"));
        assertThat(oneSecondEarlier)
                .extracting(FireTime::eventName, FireTime::alertKind)
                .containsExactlyInAnyOrder(tuple("dhuhr", AlertKind.PRIMARY), tuple("dhuhr", AlertKind.SECONDARY));
    }

    @Test
    void subSecondInstantsShouldBeComparedAtStoredPrecision() {
        Map<String, PrayerSlot> prayers = Map.of("fajr",
                new PrayerSlot(Instant.parse("2026-01-15T06:00:00.500Z"), Instant.parse("2026-01-15T06:30:01.700Z")));
        ScheduleEntry entry = new ScheduleEntry("m1", LocalDate.of(2026, 1, 15), prayers);
        Preference pref = new Preference("u1", "m1", Map.of("fajr", new PrayerAlertSetting(true, true)));

        List<FireTime> out = resolver.resolve(entry, pref, Instant.parse("2026-01-15T06:00:00.200Z"));

        // start truncates to 06:00:00, not after now; the jamaat lead becomes 06:00:01
        assertThat(out)
                .extracting(FireTime::alertKind, FireTime::fireInstant)
                .containsExactly(tuple(AlertKind.SECONDARY, Instant.parse("2026-01-15T06:00:01Z")));
    }

    @Test
    void disabledFlagsAndUnknownPrayersShouldProduceNothing() {
        Map<String, PrayerAlertSetting> settings = new LinkedHashMap<>();
        settings.put("fajr", PrayerAlertSetting.NONE);
        settings.put("tahajjud", new PrayerAlertSetting(true, true));
        settings.put("isha", null);
        Preference pref = new Preference("u1", "m1", settings);

        assertThat(resolver.resolve(january15(), pref, Instant.parse("2026-01-15T00:00:00Z"))).isEmpty();
    }

    @Test
    void missingSecondaryTimeShouldOnlySkipThatKind() {
        Preference pref = new Preference("u1", "m1", Map.of("asr", new PrayerAlertSetting(true, true)));

        List<FireTime> out = resolver.resolve(january15(), pref, Instant.parse("2026-01-15T00:00:00Z"));

        assertThat(out).containsExactly(new FireTime("asr", AlertKind.PRIMARY, Instant.parse("2026-01-15T14:10:00Z")));
    }

    @Test
    void secondaryAlertShouldLeadCongregationTimeAcrossDaylightSavingChange() {
        // London switches to BST at 01:00 UTC on 2026-03-29; instants are absolute so the lead stays 30 minutes
        ScheduleEntry entry = new ScheduleEntry("m1", LocalDate.of(2026, 3, 29),
                Map.of("tahajjud", new PrayerSlot(null, Instant.parse("2026-03-29T01:15:00Z"))));
        Preference pref = new Preference("u1", "m1", Map.of("tahajjud", new PrayerAlertSetting(false, true)));

        List<FireTime> out = resolver.resolve(entry, pref, Instant.parse("2026-03-29T00:00:00Z"));

        assertThat(out).containsExactly(
                new FireTime("tahajjud", AlertKind.SECONDARY, Instant.parse("2026-03-29T00:45:00Z")));
    }
}
