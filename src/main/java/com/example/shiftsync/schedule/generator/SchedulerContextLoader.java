package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.WeekCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Builds the {@link SchedulerContext} for one run. Reads only. A category whose fetch fails
 * is logged and treated as not configured, so the run continues with what could be loaded.
 */
@Component
public class SchedulerContextLoader {
    private static final Logger logger = LoggerFactory.getLogger(SchedulerContextLoader.class);

    private final SchedulingDataSource dataSource;

    public SchedulerContextLoader(SchedulingDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public SchedulerContext load(Long restaurantId, LocalDate weekStart) {
        return load(restaurantId, weekStart, WeekCalendar.weekEnd(weekStart), WeekCalendar.monthOf(weekStart));
    }

    public SchedulerContext load(Long restaurantId, LocalDate weekStart, LocalDate weekEnd, YearMonth month) {
        logger.info("Loading scheduling context for restaurant {} week {} - {}", restaurantId, weekStart, weekEnd);

        List<StaffMember> employees = fetch("employees", () -> dataSource.listEmployees(restaurantId)).stream()
                .filter(StaffMember::isSchedulable)
                .sorted(Comparator.comparing(StaffMember::id))
                .toList();
        List<Long> employeeIds = employees.stream().map(StaffMember::id).toList();

        Map<Long, PreferenceProfile> preferences = new LinkedHashMap<>();
        for (PreferenceProfile profile : fetch("preferences", () -> dataSource.listPreferences(employeeIds))) {
            preferences.put(profile.employeeId(), profile);
        }
        int defaulted = 0;
        for (Long id : employeeIds) {
            if (!preferences.containsKey(id)) {
                preferences.put(id, PreferenceProfile.defaults(id));
                defaulted++;
            }
        }

        Map<Long, List<AvailabilityBlock>> availability = fetch("availability",
                () -> dataSource.listAvailability(restaurantId)).stream()
                .collect(Collectors.groupingBy(AvailabilityBlock::employeeId));

        Map<Integer, OpeningHours> businessHours = new HashMap<>();
        for (OpeningHours hours : fetch("business hours", () -> dataSource.listBusinessHours(restaurantId))) {
            businessHours.put(hours.dayOfWeek(), hours);
        }

        List<StaffingSlot> staffing = fetch("staffing requirements",
                () -> dataSource.listStaffingRequirements(restaurantId)).stream()
                .sorted(Comparator.comparingInt(StaffingSlot::dayOfWeek).thenComparing(StaffingSlot::start))
                .toList();

        Map<Long, List<ExistingShift>> monthShifts = fetch("month shifts",
                () -> dataSource.listShifts(restaurantId, month.atDay(1), month.atEndOfMonth())).stream()
                .collect(Collectors.groupingBy(ExistingShift::employeeId));

        LocalDate dayBefore = weekStart.minusDays(1);
        List<ExistingShift> carryOver = fetch("previous day shifts",
                () -> dataSource.listShifts(restaurantId, dayBefore, dayBefore));

        Map<Long, List<TimeOffWindow>> timeOff = fetch("time off",
                () -> dataSource.listApprovedTimeOff(restaurantId, weekStart, weekEnd)).stream()
                .collect(Collectors.groupingBy(TimeOffWindow::employeeId));

        logger.info("Context loaded: {} employees ({} with default preferences), {} business-hour days, "
                        + "{} staffing requirements, {} employees with month shifts, {} carry-over shifts",
                employees.size(), defaulted, businessHours.size(), staffing.size(),
                monthShifts.size(), carryOver.size());

        return new SchedulerContext(restaurantId, weekStart, weekEnd, month, employees, preferences,
                availability, businessHours, staffing, monthShifts, carryOver, timeOff);
    }

    private <T> List<T> fetch(String category, Supplier<List<T>> query) {
        try {
            List<T> result = query.get();
            return result != null ? result : List.of();
        } catch (RuntimeException ex) {
            logger.warn("Failed to load {}; continuing without it: {}", category, ex.getMessage(), ex);
            return List.of();
        }
    }
}
