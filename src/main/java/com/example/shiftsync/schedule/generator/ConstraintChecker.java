package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.common.WeekCalendar;
import com.example.shiftsync.config.SchedulerSettings;
import com.example.shiftsync.conflict.ConflictDetector;
import com.example.shiftsync.conflict.ScheduledWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Objects;

/**
 * Hard constraints. An employee failing any of these is not considered for the slot.
 */
@Component
public class ConstraintChecker {

    private final SchedulerSettings settings;
    private final ConflictDetector conflictDetector;

    public ConstraintChecker(SchedulerSettings settings, ConflictDetector conflictDetector) {
        this.settings = settings;
        this.conflictDetector = conflictDetector;
    }

    /**
     * False when the date is inside approved time off, or when an availability block for that
     * date (weekly by day index, or one-off by date) is all-day or overlaps the slot.
     */
    public boolean isAvailable(Long employeeId, LocalDate date, LocalTime start, LocalTime end, SchedulerContext context) {
        for (TimeOffWindow timeOff : context.timeOffFor(employeeId)) {
            if (timeOff.covers(date)) {
                return false;
            }
        }
        int dayIndex = WeekCalendar.dayIndex(date);
        for (AvailabilityBlock block : context.availabilityFor(employeeId)) {
            if (!block.appliesTo(date, dayIndex)) {
                continue;
            }
            if (block.allDay()) {
                return false;
            }
            if (block.hasWindow()
                    && TimeRanges.overlaps(start, end, block.unavailableStart(), block.unavailableEnd())) {
                return false;
            }
        }
        return true;
    }

    /**
     * False when the employee already holds a shift on the same date that overlaps the slot.
     */
    public boolean isFreeOfOverlap(Long employeeId, LocalDate date, LocalTime start, LocalTime end,
                                   Collection<? extends ScheduledWindow> runShifts) {
        return !conflictDetector.hasConflicts(employeeId, date, start, end, runShifts, null);
    }

    /**
     * Checks the gap between every shift the employee holds on the previous calendar day and
     * the candidate start. A previous shift running past midnight is measured from its actual
     * end on the candidate's date.
     */
    public boolean hasAdequateRest(Long employeeId, LocalDate date, LocalTime start,
                                   Collection<? extends ScheduledWindow> previousShifts) {
        LocalDate previousDay = date.minusDays(1);
        long minRestMinutes = settings.getMinRestHours() * 60L;
        for (ScheduledWindow shift : previousShifts) {
            if (!Objects.equals(shift.employeeId(), employeeId) || !previousDay.equals(shift.shiftDate())) {
                continue;
            }
            long restMinutes = restMinutes(shift.startTime(), shift.endTime(), start);
            if (restMinutes < minRestMinutes) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when adding {@code candidateHours} to what the employee already holds in this run
     * would pass the standard week (unless overtime is allowed) or the absolute weekly limit.
     */
    public boolean exceedsWeeklyHours(Long employeeId, double candidateHours,
                                      Collection<? extends ScheduledWindow> runShifts, boolean allowOvertime) {
        double weekHours = runShifts.stream()
                .filter(s -> Objects.equals(s.employeeId(), employeeId))
                .mapToDouble(s -> TimeRanges.durationHours(s.startTime(), s.endTime()))
                .sum();
        double total = weekHours + candidateHours;
        if (!allowOvertime && total > settings.getStandardWeeklyHours()) {
            return true;
        }
        return total > settings.getMaxWeeklyHours();
    }

    static long restMinutes(LocalTime previousStart, LocalTime previousEnd, LocalTime nextStart) {
        int next = TimeRanges.toMinutes(nextStart);
        int end = TimeRanges.toMinutes(previousEnd);
        if (TimeRanges.crossesMidnight(previousStart, previousEnd)) {
            return next - end;
        }
        return TimeRanges.MINUTES_PER_DAY + next - end;
    }
}
