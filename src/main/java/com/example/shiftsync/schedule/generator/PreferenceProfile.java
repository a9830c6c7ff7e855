package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.employee.EmployeePreferences;

import java.time.LocalTime;
import java.util.Optional;

/**
 * Soft scheduling preferences of one employee. {@link Source} tells whether the values come
 * from the employee's own settings or were filled in because none were stored.
 */
public record PreferenceProfile(Long employeeId,
                                int targetMonthlyHours,
                                LocalTime preferredStartTime,
                                Double preferredShiftLengthHours,
                                int maxDaysPerWeek,
                                boolean prefersWeekends,
                                Source source) {

    public enum Source { CONFIGURED, DEFAULTED }

    public static final int DEFAULT_TARGET_MONTHLY_HOURS = 160;
    public static final int DEFAULT_MAX_DAYS_PER_WEEK = 6;

    public static PreferenceProfile defaults(Long employeeId) {
        return new PreferenceProfile(employeeId, DEFAULT_TARGET_MONTHLY_HOURS, null, null,
                DEFAULT_MAX_DAYS_PER_WEEK, true, Source.DEFAULTED);
    }

    public static PreferenceProfile from(EmployeePreferences prefs) {
        return new PreferenceProfile(
                prefs.getEmployee().getId(),
                prefs.getTargetMonthlyHours() == null ? DEFAULT_TARGET_MONTHLY_HOURS : prefs.getTargetMonthlyHours(),
                prefs.getPreferredShiftStartTime(),
                prefs.getPreferredShiftLengthHours(),
                prefs.getMaxDaysPerWeek() == null ? DEFAULT_MAX_DAYS_PER_WEEK : prefs.getMaxDaysPerWeek(),
                !Boolean.FALSE.equals(prefs.getPrefersWeekends()),
                Source.CONFIGURED);
    }

    public boolean isDefaulted() {
        return source == Source.DEFAULTED;
    }

    public Optional<LocalTime> preferredStart() {
        return Optional.ofNullable(preferredStartTime);
    }

    public Optional<Double> preferredLength() {
        return Optional.ofNullable(preferredShiftLengthHours).filter(h -> h > 0);
    }
}
