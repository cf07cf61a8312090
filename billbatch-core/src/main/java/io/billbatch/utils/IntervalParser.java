package io.billbatch.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the interval strings used in configuration.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "30"</li>
 *   <li>Compact units: "500ms", "45s", "10m", "2h", "1d", "1w"</li>
 *   <li>Human text: "5 minutes", "1 hour 30 minutes", "2 days"</li>
 *   <li>Cron (5 or 6 fields, only for schedules): "0 3 * * *"</li>
 *   <li>Daily time (only for schedules): "AT 03:00"</li>
 * </ul>
 */
public final class IntervalParser {
    private static final Pattern COMPACT = Pattern.compile("^(\\d+)\\s*(ms|s|m|h|d|w)$");
    private static final String DAILY_PREFIX = "AT ";

    private IntervalParser() {
    }

    /**
     * Next time a recurring schedule fires after {@code from}.
     *
     * @param schedule interval, cron expression or "AT HH:mm"
     * @param zone     zone used for cron and daily schedules; null means system default
     * @param from     reference instant, usually the previous run or now
     */
    public static Instant nextRun(String schedule, ZoneId zone, Instant from) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(from, "from must not be null");
        ZoneId effectiveZone = zone != null ? zone : ZoneId.systemDefault();
        String s = schedule.trim();

        if (s.toUpperCase(Locale.ROOT).startsWith(DAILY_PREFIX)) {
            LocalTime timeOfDay = parseTimeOfDay(s.substring(DAILY_PREFIX.length()).trim());
            ZonedDateTime base = ZonedDateTime.ofInstant(from, effectiveZone);
            ZonedDateTime candidate = base.with(timeOfDay);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1);
            }
            return candidate.toInstant();
        }

        if (looksLikeCron(s)) {
            return nextCronFire(toQuartzCron(s), effectiveZone, from);
        }

        Duration every = parseDuration(s);
        if (every.isZero()) {
            throw new IllegalArgumentException("schedule interval must be positive: " + schedule);
        }
        return from.plus(every);
    }

    /**
     * Parse a fixed interval (no cron, no daily time).
     */
    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("interval must not be empty");
        }

        if (s.matches("^\\d+$")) {
            return Duration.ofSeconds(parseCount(s, input));
        }

        Matcher compact = COMPACT.matcher(s);
        if (compact.matches()) {
            long n = parseCount(compact.group(1), input);
            return switch (compact.group(2)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + input);
            };
        }

        return parseHumanDuration(s, input);
    }

    /**
     * Returns true if the string is a 5- or 6-field cron expression Quartz accepts.
     */
    public static boolean looksLikeCron(String spec) {
        if (spec == null) {
            return false;
        }
        int fields = spec.trim().split("\\s+").length;
        if (fields != 5 && fields != 6) {
            return false;
        }
        try {
            return CronExpression.isValidExpression(toQuartzCron(spec));
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Quartz needs a seconds field and exactly one of day-of-month / day-of-week set to "?".
     */
    static String toQuartzCron(String spec) {
        String[] parts = spec.trim().split("\\s+");
        String[] fields = parts.length == 5
                ? new String[]{"0", parts[0], parts[1], parts[2], parts[3], parts[4]}
                : parts.clone();
        if (fields.length != 6) {
            throw new IllegalArgumentException("cron must have 5 or 6 fields: " + spec);
        }
        if ("*".equals(fields[3]) && "*".equals(fields[5])) {
            fields[5] = "?";
        } else if ("*".equals(fields[3])) {
            fields[3] = "?";
        } else if ("*".equals(fields[5])) {
            fields[5] = "?";
        }
        return String.join(" ", fields);
    }

    private static Instant nextCronFire(String cron, ZoneId zone, Instant from) {
        CronExpression expression;
        try {
            expression = new CronExpression(cron);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, e);
        }
        expression.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = expression.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression never fires after " + from + ": " + cron);
        }
        return next.toInstant();
    }

    private static Duration parseHumanDuration(String s, String original) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval, expected pairs like '3 minutes': " + original);
        }

        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(parts[i], original);
            String unit = parts[i + 1];
            if (unit.endsWith("s") && unit.length() > 2) {
                unit = unit.substring(0, unit.length() - 1);
            }
            total = total.plus(switch (unit) {
                case "millisecond", "milli", "ms" -> Duration.ofMillis(n);
                case "second", "sec" -> Duration.ofSeconds(n);
                case "minute", "min" -> Duration.ofMinutes(n);
                case "hour" -> Duration.ofHours(n);
                case "day" -> Duration.ofDays(n);
                case "week" -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported interval unit '" + parts[i + 1] + "' in: " + original);
            });
        }
        return total;
    }

    private static long parseCount(String digits, String original) {
        try {
            long n = Long.parseLong(digits);
            if (n < 0) {
                throw new IllegalArgumentException("interval values must not be negative: " + original);
            }
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in interval: " + original);
        }
    }

    private static LocalTime parseTimeOfDay(String timeOfDay) {
        try {
            return LocalTime.parse(timeOfDay);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time of day, expected HH:mm or HH:mm:ss: " + timeOfDay);
        }
    }
}
