package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.employee.EmployeeAvailability;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A window in which an employee cannot work, either weekly ({@code dayOfWeek}, Monday=0)
 * or on one {@code specificDate}.
 */
public record AvailabilityBlock(Long employeeId,
                                Integer dayOfWeek,
                                LocalDate specificDate,
                                LocalTime unavailableStart,
                                LocalTime unavailableEnd,
                                boolean allDay,
                                boolean recurring,
                                String reason) {

    public static AvailabilityBlock from(EmployeeAvailability availability) {
        return new AvailabilityBlock(
                availability.getEmployee().getId(),
                availability.getDayOfWeek(),
                availability.getSpecificDate(),
                availability.getUnavailableStartTime(),
                availability.getUnavailableEndTime(),
                Boolean.TRUE.equals(availability.getAllDay()),
                !Boolean.FALSE.equals(availability.getRecurring()),
                availability.getReason());
    }

    public static AvailabilityBlock weeklyAllDay(Long employeeId, int dayOfWeek) {
        return new AvailabilityBlock(employeeId, dayOfWeek, null, null, null, true, true, null);
    }

    public static AvailabilityBlock weekly(Long employeeId, int dayOfWeek, LocalTime start, LocalTime end) {
        return new AvailabilityBlock(employeeId, dayOfWeek, null, start, end, false, true, null);
    }

    public static AvailabilityBlock onDate(Long employeeId, LocalDate date, LocalTime start, LocalTime end) {
        return new AvailabilityBlock(employeeId, null, date, start, end, start == null || end == null, false, null);
    }

    public boolean appliesTo(LocalDate date, int dayIndex) {
        if (recurring) {
            return dayOfWeek != null && dayOfWeek == dayIndex;
        }
        return Objects.equals(specificDate, date);
    }

    public boolean hasWindow() {
        return unavailableStart != null && unavailableEnd != null;
    }
}
