package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.employee.Employee;

import java.util.Optional;

/**
 * Read-only view of an employee for one generation run.
 */
public record StaffMember(Long id,
                          String firstName,
                          String lastName,
                          String role,
                          String position,
                          Double hourlyRate,
                          boolean active) {

    public static StaffMember from(Employee employee) {
        return new StaffMember(
                employee.getId(),
                employee.getFirstName(),
                employee.getLastName(),
                employee.getRole(),
                employee.getPosition(),
                employee.getHourlyRate(),
                !Boolean.FALSE.equals(employee.getActive()));
    }

    public String fullName() {
        return firstName + " " + lastName;
    }

    public boolean isManager() {
        return Employee.ROLE_MANAGER.equalsIgnoreCase(role);
    }

    public boolean isSchedulable() {
        return active && !isManager();
    }

    /** Rate if one is configured; a zero rate counts as not configured. */
    public Optional<Double> rateIfSet() {
        return Optional.ofNullable(hourlyRate).filter(rate -> rate > 0);
    }
}
