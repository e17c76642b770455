package io.recur4j.core;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Admission window of civil hours {@code [startHour, endHour)}, optionally closed on weekends.
 *
 * <p>The window is always evaluated in an explicit {@link ZoneId}, never in the JVM default zone,
 * so a host running in UTC still honours e.g. Eastern business hours across DST changes.
 * No relation between {@code startHour} and {@code endHour} is enforced: a window with
 * {@code startHour >= endHour} is simply never open.
 */
public record BusinessHours(int startHour, int endHour, boolean skipWeekends) {

    public BusinessHours {
        checkHour("startHour", startHour);
        checkHour("endHour", endHour);
    }

    /**
     * Weekday-only window.
     */
    public static BusinessHours of(int startHour, int endHour) {
        return new BusinessHours(startHour, endHour, true);
    }

    public boolean isWithinBusinessHours(Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        ZonedDateTime civil = now.atZone(zone);
        int hour = civil.getHour();
        if (hour < startHour || hour >= endHour) {
            return false;
        }
        if (skipWeekends) {
            DayOfWeek day = civil.getDayOfWeek();
            return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("%02d:00-%02d:00%s", startHour, endHour, skipWeekends ? " weekdays" : "");
    }

    private static void checkHour(String field, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(field + " must be in [0,23]: " + hour);
        }
    }
}
