package com.example.shiftsync.schedule;

import java.time.LocalDate;
import java.time.LocalTime;

public record ShiftDto(
        Long id,
        Long restaurantId,
        Long employeeId,
        String employeeName,
        LocalDate shiftDate,
        LocalTime startTime,
        LocalTime endTime,
        String position,
        String notes) {

    public static ShiftDto from(Shift shift) {
        return new ShiftDto(
                shift.getId(),
                shift.getRestaurantId(),
                shift.getEmployee().getId(),
                shift.getEmployee().getFullName(),
                shift.getShiftDate(),
                shift.getStartTime(),
                shift.getEndTime(),
                shift.getPosition(),
                shift.getNotes()
        );
    }
}
