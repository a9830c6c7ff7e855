package com.example.shiftsync.schedule.generator;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Read side of the generator. Implementations may throw on storage failures; the
 * {@link SchedulerContextLoader} turns a failed category into an empty one.
 */
public interface SchedulingDataSource {

    List<StaffMember> listEmployees(Long restaurantId);

    List<PreferenceProfile> listPreferences(Collection<Long> employeeIds);

    List<AvailabilityBlock> listAvailability(Long restaurantId);

    List<OpeningHours> listBusinessHours(Long restaurantId);

    List<StaffingSlot> listStaffingRequirements(Long restaurantId);

    /** Shifts with {@code from <= shiftDate <= to}. */
    List<ExistingShift> listShifts(Long restaurantId, LocalDate from, LocalDate to);

    /** Approved time off intersecting {@code [from, to]}. */
    List<TimeOffWindow> listApprovedTimeOff(Long restaurantId, LocalDate from, LocalDate to);
}
