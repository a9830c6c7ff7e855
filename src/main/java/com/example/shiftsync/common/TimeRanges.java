package com.example.shiftsync.common;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;

/**
 * Wall-clock interval arithmetic shared by conflict detection, constraints and statistics.
 * An end time earlier than its start time means the interval runs past midnight.
 */
public final class TimeRanges {

    public static final int MINUTES_PER_DAY = 24 * 60;
    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private TimeRanges() {
    }

    public static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    public static boolean crossesMidnight(LocalTime start, LocalTime end) {
        return end.isBefore(start);
    }

    /**
     * Half-open overlap test: touching endpoints do not overlap.
     * Times are compared on a 24h clock, so an overnight range also collides with an
     * early-morning range on the same date.
     */
    public static boolean overlaps(LocalTime startA, LocalTime endA, LocalTime startB, LocalTime endB) {
        int sA = toMinutes(startA);
        int eA = endMinutes(startA, endA);
        int sB = toMinutes(startB);
        int eB = endMinutes(startB, endB);
        return intersects(sA, eA, sB, eB)
                || intersects(sA, eA, sB + MINUTES_PER_DAY, eB + MINUTES_PER_DAY)
                || intersects(sA + MINUTES_PER_DAY, eA + MINUTES_PER_DAY, sB, eB);
    }

    public static long durationMinutes(LocalTime start, LocalTime end) {
        return endMinutes(start, end) - toMinutes(start);
    }

    public static double durationHours(LocalTime start, LocalTime end) {
        return durationMinutes(start, end) / 60.0;
    }

    public static String format(LocalTime time) {
        return time == null ? "" : HH_MM.format(time);
    }

    private static int endMinutes(LocalTime start, LocalTime end) {
        int minutes = toMinutes(end);
        if (crossesMidnight(start, end)) {
            minutes += MINUTES_PER_DAY;
        }
        return minutes;
    }

    private static boolean intersects(int startA, int endA, int startB, int endB) {
        return startA < endB && startB < endA;
    }
}
