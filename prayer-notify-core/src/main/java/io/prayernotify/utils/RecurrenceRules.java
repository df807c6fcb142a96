package io.prayernotify.utils;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Evaluates recurring job rules.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Daily time of day: "AT 00:30", "AT 06:15:30"</li>
 *   <li>Cron expressions, 5 fields (minute precision) or 6 fields (with seconds), e.g. "30 0 * * *"</li>
 * </ul>
 * <p>
 * Both are calendar based and evaluated in the rule's zone, so a daily rule keeps its civil time
 * across daylight-saving changes.
 */
public final class RecurrenceRules {
    private static final String AT_PREFIX = "AT ";

    private RecurrenceRules() {
    }

    /**
     * Computes the next run time from persisted scheduling fields.
     *
     * @param rule              scheduled_jobs.repeatRule
     * @param timezone          scheduled_jobs.repeatTimezone (IANA, nullable)
     * @param previousNextRunAt scheduled_jobs.nextRunAt from previous cycle
     * @param finishedAt        current execution finish time
     * @return next scheduled run time, or {@code null} for one-time jobs
     */
    public static Instant computeNextRunAt(
            String rule,
            String timezone,
            Instant previousNextRunAt,
            Instant finishedAt
    ) {
        if (rule == null || rule.isBlank()) {
            return null;
        }
        return nextOccurrence(rule, timezone, laterOf(previousNextRunAt, finishedAt));
    }

    /**
     * Returns the first occurrence of {@code rule} strictly after {@code from}.
     */
    public static Instant nextOccurrence(String rule, String timezone, Instant from) {
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("rule must not be blank");
        }
        if (from == null) {
            throw new IllegalArgumentException("from must not be null");
        }

        ZoneId zone = resolveZone(timezone);
        String r = rule.trim();

        if (r.startsWith(AT_PREFIX)) {
            LocalTime lt = parseTimeOfDay(r.substring(AT_PREFIX.length()).trim());
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(lt);
            if (!candidate.isAfter(base)) {
                candidate = base.plusDays(1).with(lt);
            }
            return candidate.toInstant();
        }

        return nextCronOccurrence(normalizeCron(r), zone, from);
    }

    /**
     * Validates a rule without evaluating it against a clock.
     */
    public static void validate(String rule) {
        if (rule == null || rule.isBlank()) {
            throw new IllegalArgumentException("rule must not be blank");
        }
        String r = rule.trim();
        if (r.startsWith(AT_PREFIX)) {
            parseTimeOfDay(r.substring(AT_PREFIX.length()).trim());
            return;
        }
        if (!looksLikeCron(r)) {
            throw new IllegalArgumentException("Unsupported recurrence rule: " + rule);
        }
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 6-field cron (with seconds).
     * - Accepts 5-field cron by prepending seconds "0".
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        // Quartz wants exactly one of day-of-month / day-of-week to be '?'
        if ("*".equals(dow) || "?".equals(dow)) {
            dow = "?";
            if ("?".equals(dom)) {
                dom = "*";
            }
        } else if ("*".equals(dom) || "?".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static Instant nextCronOccurrence(String cron, ZoneId zone, Instant from) {
        if (!CronExpression.isValidExpression(cron)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron);
        }
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (java.text.ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    private static LocalTime parseTimeOfDay(String timeOfDay) {
        try {
            return LocalTime.parse(timeOfDay);
        } catch (java.time.format.DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid time of day. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timezone);
    }

    private static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
