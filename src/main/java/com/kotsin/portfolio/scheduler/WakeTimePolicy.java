package com.kotsin.portfolio.scheduler;

import com.kotsin.portfolio.model.ScheduleOptions;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Market-hours aware wake calculation. Pure: the result depends only on the
 * arguments, the reference zone and the weekend policy.
 *
 * <p>Candidate wakes of a day are the intraday slots {@code start + k * interval}
 * strictly before {@code end} (weekdays only) plus the morning and night
 * checkpoints. The next wake is the earliest candidate strictly after now.
 */
public class WakeTimePolicy {

    private static final int LOOKAHEAD_DAYS = 8;

    private final ZoneId zone;
    private final WeekendPolicy weekendPolicy;

    public WakeTimePolicy(ZoneId zone, WeekendPolicy weekendPolicy) {
        this.zone = zone;
        this.weekendPolicy = weekendPolicy;
    }

    public Instant nextWake(Instant now, ScheduleOptions options) {
        return nextWake(now.atZone(zone), options).toInstant();
    }

    public ZonedDateTime nextWake(ZonedDateTime now, ScheduleOptions options) {
        ZonedDateTime local = now.withZoneSameInstant(zone);
        LocalDate today = local.toLocalDate();
        for (int day = 0; day <= LOOKAHEAD_DAYS; day++) {
            LocalDate date = today.plusDays(day);
            ZonedDateTime best = null;
            for (LocalTime t : candidates(date, options)) {
                ZonedDateTime candidate = ZonedDateTime.of(date, t, zone);
                if (candidate.isAfter(local) && (best == null || candidate.isBefore(best))) {
                    best = candidate;
                }
            }
            if (best != null) {
                return best;
            }
        }
        throw new IllegalStateException("No wake time within " + LOOKAHEAD_DAYS + " days of " + now);
    }

    List<LocalTime> candidates(LocalDate date, ScheduleOptions options) {
        List<LocalTime> times = new ArrayList<>();
        boolean weekend = isWeekend(date.getDayOfWeek());
        if (!weekend) {
            int endMinute = options.getEndHour() * 60;
            for (int minute = options.getStartHour() * 60; minute < endMinute; minute += options.getIntervalMinutes()) {
                times.add(LocalTime.of(minute / 60, minute % 60));
            }
        }
        if (!weekend || weekendPolicy == WeekendPolicy.CHECKPOINTS) {
            times.add(options.getMorningUpdate());
            times.add(options.getNightUpdate());
        }
        return times;
    }

    public ZoneId getZone() {
        return zone;
    }

    public WeekendPolicy getWeekendPolicy() {
        return weekendPolicy;
    }

    private static boolean isWeekend(DayOfWeek dow) {
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }
}
