package com.kotsin.portfolio.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalTime;

/**
 * Per-portfolio refresh windows.
 *
 * <p>Defaults poll every 15 minutes between 09:00 and 21:00 on weekdays,
 * plus a night checkpoint at 22:05 and a morning checkpoint at 04:00.
 */
@Value
public class ScheduleOptions {

    public static final int DEFAULT_INTERVAL_MINUTES = 15;
    public static final int DEFAULT_START_HOUR = 9;
    public static final int DEFAULT_END_HOUR = 21;
    public static final LocalTime DEFAULT_NIGHT_UPDATE = LocalTime.of(22, 5);
    public static final LocalTime DEFAULT_MORNING_UPDATE = LocalTime.of(4, 0);

    int intervalMinutes;
    int startHour;
    int endHour;
    LocalTime nightUpdate;
    LocalTime morningUpdate;

    @Builder
    public ScheduleOptions(Integer intervalMinutes, Integer startHour, Integer endHour,
                           LocalTime nightUpdate, LocalTime morningUpdate) {
        this.intervalMinutes = intervalMinutes != null ? intervalMinutes : DEFAULT_INTERVAL_MINUTES;
        this.startHour = startHour != null ? startHour : DEFAULT_START_HOUR;
        this.endHour = endHour != null ? endHour : DEFAULT_END_HOUR;
        this.nightUpdate = nightUpdate != null ? nightUpdate : DEFAULT_NIGHT_UPDATE;
        this.morningUpdate = morningUpdate != null ? morningUpdate : DEFAULT_MORNING_UPDATE;

        if (this.intervalMinutes < 1 || this.intervalMinutes > 60) {
            throw new IllegalArgumentException("intervalMinutes must be within 1..60, got " + this.intervalMinutes);
        }
        checkHour("startHour", this.startHour);
        checkHour("endHour", this.endHour);
    }

    public static ScheduleOptions defaults() {
        return ScheduleOptions.builder().build();
    }

    /**
     * Parses an {@code HH:MM} wall-clock time; blank input yields {@code null} (use the default).
     */
    public static LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String[] parts = value.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected HH:MM but got '" + value + "'");
        }
        try {
            return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException | java.time.DateTimeException e) {
            throw new IllegalArgumentException("Expected HH:MM but got '" + value + "'", e);
        }
    }

    private static void checkHour(String name, int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(name + " must be within 0..23, got " + hour);
        }
    }
}
