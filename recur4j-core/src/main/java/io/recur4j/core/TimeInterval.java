package io.recur4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * A positive duration expressed as a value in one unit, e.g. {@code 30 seconds} or {@code 24 hours}.
 */
public record TimeInterval(long value, IntervalUnit unit) {

    public TimeInterval {
        Objects.requireNonNull(unit, "unit must not be null");
        if (value <= 0) {
            throw new IllegalArgumentException("interval value must be positive: " + value);
        }
    }

    public static TimeInterval ofSeconds(long seconds) {
        return new TimeInterval(seconds, IntervalUnit.SECONDS);
    }

    public static TimeInterval ofMinutes(long minutes) {
        return new TimeInterval(minutes, IntervalUnit.MINUTES);
    }

    public static TimeInterval ofHours(long hours) {
        return new TimeInterval(hours, IntervalUnit.HOURS);
    }

    public long toMilliseconds() {
        return Math.multiplyExact(value, unit.millis());
    }

    public Duration toDuration() {
        return Duration.ofMillis(toMilliseconds());
    }

    @Override
    public String toString() {
        return value + " " + unit.label(value);
    }
}
