package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.conflict.ScheduledWindow;
import com.example.shiftsync.schedule.Shift;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A shift already stored for the restaurant.
 */
public record ExistingShift(Long id, Long employeeId, LocalDate shiftDate, LocalTime startTime, LocalTime endTime)
        implements ScheduledWindow {

    public static ExistingShift from(Shift shift) {
        return new ExistingShift(shift.getId(), shift.getEmployee().getId(), shift.getShiftDate(),
                shift.getStartTime(), shift.getEndTime());
    }

    public double hours() {
        return TimeRanges.durationHours(startTime, endTime);
    }
}
