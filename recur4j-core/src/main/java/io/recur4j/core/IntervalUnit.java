package io.recur4j.core;

public enum IntervalUnit {

    SECONDS(1_000L, "second"),
    MINUTES(60_000L, "minute"),
    HOURS(3_600_000L, "hour");

    private final long millis;
    private final String singular;

    IntervalUnit(long millis, String singular) {
        this.millis = millis;
        this.singular = singular;
    }

    public long millis() {
        return millis;
    }

    public String label(long value) {
        return value == 1 ? singular : singular + "s";
    }
}
