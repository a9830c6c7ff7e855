package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.timeoff.TimeOffRequest;

import java.time.LocalDate;

/**
 * Approved time off, both dates inclusive.
 */
public record TimeOffWindow(Long employeeId, LocalDate startDate, LocalDate endDate) {

    public static TimeOffWindow from(TimeOffRequest request) {
        return new TimeOffWindow(request.getEmployee().getId(), request.getStartDate(), request.getEndDate());
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
