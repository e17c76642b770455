package io.recur4j.utils;

import io.recur4j.core.IntervalUnit;
import io.recur4j.core.TimeInterval;

import java.util.Objects;

/**
 * Parses human-readable interval specs into {@link TimeInterval}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Plain seconds: "90"</li>
 *   <li>Compact: "30s", "5m", "2h", "1d"</li>
 *   <li>Unit pairs: "5 minutes", "1 hour 30 minutes", "1 day"</li>
 * </ul>
 * <p>
 * Days and weeks are accepted as multiples of hours. The result uses the largest unit that
 * divides the total evenly, so "90 minutes" stays in minutes and "120 minutes" becomes 2 hours.
 */
public final class IntervalParser {
    private static final long MINUTE = 60L;
    private static final long HOUR = 60L * MINUTE;
    private static final long DAY = 24L * HOUR;

    private IntervalParser() {
    }

    public static TimeInterval parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        try {
            return doParse(input);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Interval is too large: " + input);
        }
    }

    private static TimeInterval doParse(String input) {
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            return normalize(parseCount(s, input), input);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = parseCount(digits, input);
            long seconds = switch (u) {
                case 's' -> n;
                case 'm' -> Math.multiplyExact(n, MINUTE);
                case 'h' -> Math.multiplyExact(n, HOUR);
                case 'd' -> Math.multiplyExact(n, DAY);
                case 'w' -> Math.multiplyExact(n, 7L * DAY);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
            return normalize(seconds, input);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(parts[i], input);

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(n, 7L * DAY));
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(n, DAY));
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(n, HOUR));
                }
                case "minute", "min" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(n, MINUTE));
                }
                case "second", "sec" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = Math.addExact(totalSeconds, n);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return normalize(totalSeconds, input);
    }

    /* ================= helper ================= */

    private static long parseCount(String digits, String input) {
        long n;
        try {
            n = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number in interval: " + input);
        }
        if (n < 0) {
            throw new IllegalArgumentException("Interval values must be non-negative: " + input);
        }
        return n;
    }

    private static TimeInterval normalize(long seconds, String input) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        if (seconds % HOUR == 0) {
            return new TimeInterval(seconds / HOUR, IntervalUnit.HOURS);
        }
        if (seconds % MINUTE == 0) {
            return new TimeInterval(seconds / MINUTE, IntervalUnit.MINUTES);
        }
        return new TimeInterval(seconds, IntervalUnit.SECONDS);
    }
}
