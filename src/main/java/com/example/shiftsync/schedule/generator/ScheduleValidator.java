package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.config.SchedulerSettings;
import com.example.shiftsync.conflict.ScheduledWindow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Post-run checks and summary figures for a list of shifts.
 */
@Component
public class ScheduleValidator {

    private final SchedulerSettings settings;

    public ScheduleValidator(SchedulerSettings settings) {
        this.settings = settings;
    }

    /**
     * One warning per scheduled employee whose hours this week fall under the configured share
     * of their weekly equivalent of the monthly target.
     */
    public List<String> fairnessWarnings(Collection<? extends ScheduledWindow> shifts, SchedulerContext context) {
        List<String> warnings = new ArrayList<>();
        hoursPerEmployee(shifts).forEach((employeeId, hours) -> {
            PreferenceProfile prefs = context.preferencesFor(employeeId);
            double weeklyTarget = prefs.targetMonthlyHours() / settings.getWeeksPerMonth();
            if (hours < weeklyTarget * settings.getUnderTargetRatio()) {
                String name = context.employee(employeeId)
                        .map(StaffMember::fullName)
                        .orElse("Employee #" + employeeId);
                warnings.add(String.format(Locale.ROOT, "%s has only %.1f hours (below target)", name, hours));
            }
        });
        return warnings;
    }

    public ScheduleStats calculateStats(Collection<? extends ScheduledWindow> shifts, SchedulerContext context) {
        return calculateStats(shifts, context.employees());
    }

    /**
     * Totals, labour cost and a fairness score of {@code max(0, 100 - 10 * stddev)} over the
     * hours per scheduled employee. Employees without a positive rate are costed at the default rate.
     */
    public ScheduleStats calculateStats(Collection<? extends ScheduledWindow> shifts, Collection<StaffMember> staff) {
        if (shifts.isEmpty()) {
            return ScheduleStats.empty();
        }
        Map<Long, StaffMember> byId = staff.stream()
                .collect(Collectors.toMap(StaffMember::id, Function.identity(), (a, b) -> a));

        double totalHours = 0;
        double totalCost = 0;
        for (ScheduledWindow shift : shifts) {
            double hours = TimeRanges.durationHours(shift.startTime(), shift.endTime());
            StaffMember member = byId.get(shift.employeeId());
            double rate = member == null
                    ? settings.getDefaultHourlyRate()
                    : member.rateIfSet().orElse(settings.getDefaultHourlyRate());
            totalHours += hours;
            totalCost += hours * rate;
        }

        Map<Long, Double> hoursPerEmployee = hoursPerEmployee(shifts);
        return new ScheduleStats(shifts.size(), totalHours, totalCost, hoursPerEmployee.size(),
                fairnessScore(hoursPerEmployee.values()));
    }

    static double fairnessScore(Collection<Double> hours) {
        if (hours.isEmpty()) {
            return 0;
        }
        if (hours.size() == 1) {
            return 100;
        }
        double mean = hours.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = hours.stream()
                .mapToDouble(h -> Math.pow(h - mean, 2))
                .sum() / hours.size();
        return Math.max(0, 100 - Math.sqrt(variance) * 10);
    }

    private static Map<Long, Double> hoursPerEmployee(Collection<? extends ScheduledWindow> shifts) {
        Map<Long, Double> hours = new LinkedHashMap<>();
        for (ScheduledWindow shift : shifts) {
            hours.merge(shift.employeeId(), TimeRanges.durationHours(shift.startTime(), shift.endTime()), Double::sum);
        }
        return hours;
    }
}
