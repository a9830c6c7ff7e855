package com.example.shiftsync.schedule;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Manual shift entry. Times are checked by the service so a missing time is reported with
 * the same message as other shift validation errors.
 */
public record ShiftRequest(
        @NotNull Long restaurantId,
        @NotNull Long employeeId,
        @NotNull LocalDate shiftDate,
        LocalTime startTime,
        LocalTime endTime,
        String position,
        String notes
) {
}
