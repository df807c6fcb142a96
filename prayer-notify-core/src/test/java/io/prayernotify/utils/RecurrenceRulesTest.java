package io.prayernotify.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceRulesTest {

    @Test
    void atRuleShouldPickTodayWhenStillAhead() {
        Instant next = RecurrenceRules.nextOccurrence("AT 00:30", "Europe/London", Instant.parse("2026-01-01T00:10:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:30:00Z"), next);
    }

    @Test
    void atRuleShouldRollToTomorrowWhenPassed() {
        Instant next = RecurrenceRules.nextOccurrence("AT 00:30", "Europe/London", Instant.parse("2026-01-01T00:30:00Z"));
        assertEquals(Instant.parse("2026-01-02T00:30:00Z"), next);
    }

    @Test
    void atRuleShouldKeepCivilTimeAcrossDaylightSavingStart() {
        // London moves to BST at 01:00 UTC on 2026-03-29
        Instant beforeChange = RecurrenceRules.nextOccurrence("AT 00:30", "Europe/London", Instant.parse("2026-03-28T01:00:00Z"));
        assertEquals(Instant.parse("2026-03-29T00:30:00Z"), beforeChange);

        Instant afterChange = RecurrenceRules.nextOccurrence("AT 00:30", "Europe/London", beforeChange);
        assertEquals(Instant.parse("2026-03-29T23:30:00Z"), afterChange);
    }

    @Test
    void fiveFieldCronShouldBeSupported() {
        Instant next = RecurrenceRules.nextOccurrence("*/5 * * * *", "UTC", Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void cronShouldBeEvaluatedInRuleZone() {
        Instant next = RecurrenceRules.nextOccurrence("0 30 0 * * ?", "Europe/London", Instant.parse("2026-06-01T12:00:00Z"));
        assertEquals(Instant.parse("2026-06-01T23:30:00Z"), next);
    }

    @Test
    void computeNextRunAtShouldUseLaterOfPreviousAndFinished() {
        Instant next = RecurrenceRules.computeNextRunAt(
                "*/5 * * * *",
                "UTC",
                Instant.parse("2026-01-01T00:05:00Z"),
                Instant.parse("2026-01-01T00:06:00Z")
        );

        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void computeNextRunAtShouldReturnNullForOneOffJobs() {
        assertNull(RecurrenceRules.computeNextRunAt(null, "UTC", Instant.now(), Instant.now()));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(RecurrenceRules.looksLikeCron("0 */10 * * * *"));
        assertFalse(RecurrenceRules.looksLikeCron("every day"));
    }

    @Test
    void validateShouldRejectUnknownRules() {
        assertThrows(IllegalArgumentException.class, () -> RecurrenceRules.validate("every day"));
        assertThrows(IllegalArgumentException.class, () -> RecurrenceRules.validate("AT 25:00"));
    }
}
