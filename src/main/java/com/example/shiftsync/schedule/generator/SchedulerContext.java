package com.example.shiftsync.schedule.generator;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything one generation run reads, loaded once up front. Per-employee collections are
 * keyed by employee id; business hours are keyed by day index (Monday=0).
 *
 * @param employees        schedulable staff, ordered by id
 * @param existingShifts   stored shifts of the month containing the week start, for fairness scoring
 * @param carryOverShifts  stored shifts on the day before the week start, for the rest check only
 */
public record SchedulerContext(Long restaurantId,
                               LocalDate weekStart,
                               LocalDate weekEnd,
                               YearMonth month,
                               List<StaffMember> employees,
                               Map<Long, PreferenceProfile> preferences,
                               Map<Long, List<AvailabilityBlock>> availability,
                               Map<Integer, OpeningHours> businessHours,
                               List<StaffingSlot> staffingRequirements,
                               Map<Long, List<ExistingShift>> existingShifts,
                               List<ExistingShift> carryOverShifts,
                               Map<Long, List<TimeOffWindow>> timeOff) {

    public SchedulerContext {
        employees = List.copyOf(employees);
        preferences = Map.copyOf(preferences);
        availability = Map.copyOf(availability);
        businessHours = Map.copyOf(businessHours);
        staffingRequirements = List.copyOf(staffingRequirements);
        existingShifts = Map.copyOf(existingShifts);
        carryOverShifts = List.copyOf(carryOverShifts);
        timeOff = Map.copyOf(timeOff);
    }

    public PreferenceProfile preferencesFor(Long employeeId) {
        PreferenceProfile profile = preferences.get(employeeId);
        return profile != null ? profile : PreferenceProfile.defaults(employeeId);
    }

    public List<AvailabilityBlock> availabilityFor(Long employeeId) {
        return availability.getOrDefault(employeeId, List.of());
    }

    public List<TimeOffWindow> timeOffFor(Long employeeId) {
        return timeOff.getOrDefault(employeeId, List.of());
    }

    public List<ExistingShift> monthShiftsFor(Long employeeId) {
        return existingShifts.getOrDefault(employeeId, List.of());
    }

    public Optional<OpeningHours> openingHoursFor(int dayIndex) {
        return Optional.ofNullable(businessHours.get(dayIndex));
    }

    public List<StaffingSlot> staffingFor(int dayIndex) {
        return staffingRequirements.stream()
                .filter(slot -> slot.dayOfWeek() == dayIndex)
                .toList();
    }

    public Optional<StaffMember> employee(Long employeeId) {
        return employees.stream().filter(e -> e.id().equals(employeeId)).findFirst();
    }

    public boolean hasOpenDay() {
        return businessHours.values().stream().anyMatch(OpeningHours::isOpen);
    }
}
