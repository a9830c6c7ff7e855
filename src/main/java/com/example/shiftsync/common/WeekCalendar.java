package com.example.shiftsync.common;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Calendar helpers for the Monday-first week used by business hours, staffing
 * requirements and recurring availability (Monday=0 .. Sunday=6).
 */
public final class WeekCalendar {

    public static final int DAYS_PER_WEEK = 7;

    private WeekCalendar() {
    }

    public static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public static DayOfWeek dayOfWeek(int dayIndex) {
        if (dayIndex < 0 || dayIndex >= DAYS_PER_WEEK) {
            throw new IllegalArgumentException("day index must be between 0 and 6: " + dayIndex);
        }
        return DayOfWeek.of(dayIndex + 1);
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }

    public static boolean isMonday(LocalDate date) {
        return date.getDayOfWeek() == DayOfWeek.MONDAY;
    }

    public static LocalDate weekEnd(LocalDate weekStart) {
        return weekStart.plusDays(DAYS_PER_WEEK - 1L);
    }

    public static YearMonth monthOf(LocalDate date) {
        return YearMonth.from(date);
    }
}
