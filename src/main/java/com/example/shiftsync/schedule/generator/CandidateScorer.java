package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.common.WeekCalendar;
import com.example.shiftsync.config.SchedulerSettings;
import com.example.shiftsync.conflict.ScheduledWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/**
 * Soft constraints. Higher is better; the base score is {@value #BASE_SCORE}.
 */
@Component
public class CandidateScorer {
    static final double BASE_SCORE = 100;
    static final double MAX_DAYS_PENALTY = 100;
    private static final int CONSECUTIVE_DAYS_LIMIT = 5;

    private final SchedulerSettings settings;

    public CandidateScorer(SchedulerSettings settings) {
        this.settings = settings;
    }

    public double score(StaffMember employee,
                        LocalDate date,
                        LocalTime start,
                        LocalTime end,
                        SchedulerContext context,
                        Collection<? extends ScheduledWindow> runShifts,
                        GenerationOptions options) {
        PreferenceProfile prefs = context.preferencesFor(employee.id());
        double shiftHours = TimeRanges.durationHours(start, end);
        double score = BASE_SCORE;

        score += fairnessAdjustment(monthHours(employee.id(), context), prefs.targetMonthlyHours());

        Optional<LocalTime> preferredStart = prefs.preferredStart();
        if (preferredStart.isPresent()) {
            int diff = Math.abs(TimeRanges.toMinutes(start) - TimeRanges.toMinutes(preferredStart.get()));
            if (diff <= 30) {
                score += 10;
            } else if (diff > 120) {
                score -= 10;
            }
        }

        Optional<Double> preferredLength = prefs.preferredLength();
        if (preferredLength.isPresent()) {
            double diff = Math.abs(shiftHours - preferredLength.get());
            if (diff <= 0.5) {
                score += 10;
            } else if (diff > 2) {
                score -= 10;
            }
        }

        if (WeekCalendar.isWeekend(date)) {
            score += prefs.prefersWeekends() ? 10 : -20;
        }

        int consecutive = consecutiveDaysWorked(employee.id(), date, runShifts);
        if (consecutive >= CONSECUTIVE_DAYS_LIMIT) {
            score -= 15;
        } else if (consecutive == 0) {
            score += 5;
        }

        if (options.prioritizeCost()) {
            Optional<Double> rate = employee.rateIfSet();
            if (rate.isPresent()) {
                score -= ((rate.get() - settings.getCostBaselineRate()) / settings.getCostRateSpan()) * 10;
            }
        }

        long shiftsThisRun = runShifts.stream()
                .filter(s -> Objects.equals(s.employeeId(), employee.id()))
                .count();
        if (shiftsThisRun >= prefs.maxDaysPerWeek()) {
            score -= MAX_DAYS_PENALTY;
        }
        return score;
    }

    /** Bands on hours already worked this month as a percentage of the monthly target. */
    static double fairnessAdjustment(double monthHours, int targetMonthlyHours) {
        if (targetMonthlyHours <= 0) {
            return 0;
        }
        double percentOfTarget = monthHours / targetMonthlyHours * 100;
        if (percentOfTarget < 90) {
            return 30;
        } else if (percentOfTarget < 100) {
            return 15;
        } else if (percentOfTarget > 110) {
            return -30;
        } else if (percentOfTarget > 100) {
            return -15;
        }
        return 0;
    }

    static double monthHours(Long employeeId, SchedulerContext context) {
        return context.monthShiftsFor(employeeId).stream()
                .mapToDouble(ExistingShift::hours)
                .sum();
    }

    /** Days in a row, ending the day before {@code date}, on which the employee already works. */
    static int consecutiveDaysWorked(Long employeeId, LocalDate date, Collection<? extends ScheduledWindow> runShifts) {
        int consecutive = 0;
        LocalDate check = date.minusDays(1);
        for (int i = 0; i < WeekCalendar.DAYS_PER_WEEK; i++) {
            LocalDate day = check;
            boolean worked = runShifts.stream()
                    .anyMatch(s -> Objects.equals(s.employeeId(), employeeId) && day.equals(s.shiftDate()));
            if (!worked) {
                break;
            }
            consecutive++;
            check = check.minusDays(1);
        }
        return consecutive;
    }
}
