package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.conflict.ScheduledWindow;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A shift proposed by the generator. Not stored until a caller publishes it.
 */
public record ScheduleShift(Long employeeId,
                            LocalDate shiftDate,
                            LocalTime startTime,
                            LocalTime endTime,
                            String position,
                            String notes) implements ScheduledWindow {

    @Override
    public Long id() {
        return null;
    }

    public double hours() {
        return TimeRanges.durationHours(startTime, endTime);
    }
}
