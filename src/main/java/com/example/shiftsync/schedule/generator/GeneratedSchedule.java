package com.example.shiftsync.schedule.generator;

import java.util.List;

/**
 * Result of one run. An empty {@code shifts} list together with warnings means nothing could
 * be scheduled; the warnings say why.
 */
public record GeneratedSchedule(List<ScheduleShift> shifts, List<String> warnings, ScheduleStats stats) {

    public GeneratedSchedule {
        shifts = List.copyOf(shifts);
        warnings = List.copyOf(warnings);
    }

    public static GeneratedSchedule empty(List<String> warnings) {
        return new GeneratedSchedule(List.of(), warnings, ScheduleStats.empty());
    }

    public boolean hasShifts() {
        return !shifts.isEmpty();
    }
}
