package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.common.TimeRanges;
import com.example.shiftsync.common.WeekCalendar;
import com.example.shiftsync.config.SchedulerSettings;
import com.example.shiftsync.conflict.ScheduledWindow;
import com.example.shiftsync.exception.ScheduleGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy weekly schedule generator.
 * <p>
 * Walks the week Monday to Sunday and, for each open day, fills either the configured staffing
 * slots or the default full-day coverage one attempt at a time. Each attempt drops employees
 * that fail a hard constraint, scores the rest and takes the highest score (first seen wins a
 * tie). Assignments are never revisited, so an early choice can leave a later slot short.
 * Nothing is written; the caller decides whether to publish the result.
 */
@Service
public class ScheduleGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleGenerator.class);

    private final SchedulerContextLoader contextLoader;
    private final ConstraintChecker constraintChecker;
    private final CandidateScorer candidateScorer;
    private final ScheduleValidator scheduleValidator;
    private final SchedulerSettings settings;

    public ScheduleGenerator(SchedulerContextLoader contextLoader,
                             ConstraintChecker constraintChecker,
                             CandidateScorer candidateScorer,
                             ScheduleValidator scheduleValidator,
                             SchedulerSettings settings) {
        this.contextLoader = contextLoader;
        this.constraintChecker = constraintChecker;
        this.candidateScorer = candidateScorer;
        this.scheduleValidator = scheduleValidator;
        this.settings = settings;
    }

    /**
     * @param weekStart Monday of the target week; callers validate this
     */
    public GeneratedSchedule generateSchedule(Long restaurantId, LocalDate weekStart, GenerationOptions options) {
        GenerationOptions effective = options != null ? options : GenerationOptions.defaults();
        logger.info("Generating schedule for restaurant {} week starting {} (fairness={}, cost={}, overtime={})",
                restaurantId, weekStart, effective.prioritizeFairness(), effective.prioritizeCost(),
                effective.allowOvertime());
        try {
            SchedulerContext context = contextLoader.load(restaurantId, weekStart);
            return generateSchedule(context, effective);
        } catch (RuntimeException ex) {
            logger.error("Schedule generation failed for restaurant {} week {}", restaurantId, weekStart, ex);
            throw new ScheduleGenerationException("Failed to generate schedule for week " + weekStart, ex);
        }
    }

    public GeneratedSchedule generateSchedule(SchedulerContext context, GenerationOptions options) {
        Set<String> warnings = new LinkedHashSet<>();

        if (context.employees().isEmpty()) {
            warnings.add("No active employees found (excluding managers)");
            warnings.add("Please add employees with role=\"employee\" to your restaurant");
            logger.warn("No schedulable employees for restaurant {}", context.restaurantId());
            return GeneratedSchedule.empty(new ArrayList<>(warnings));
        }
        if (context.businessHours().isEmpty()) {
            warnings.add("No business hours configured");
            warnings.add("Please configure your business hours in Settings → Business Hours section");
            logger.warn("No business hours for restaurant {}", context.restaurantId());
            return GeneratedSchedule.empty(new ArrayList<>(warnings));
        }
        if (!context.hasOpenDay()) {
            warnings.add("All days are marked as closed");
            warnings.add("Please mark at least one day as open in Settings → Business Hours");
            logger.warn("All business days closed for restaurant {}", context.restaurantId());
            return GeneratedSchedule.empty(new ArrayList<>(warnings));
        }

        List<ScheduleShift> shifts = new ArrayList<>();
        for (int offset = 0; offset < WeekCalendar.DAYS_PER_WEEK; offset++) {
            LocalDate date = context.weekStart().plusDays(offset);
            int dayIndex = WeekCalendar.dayIndex(date);
            Optional<OpeningHours> hours = context.openingHoursFor(dayIndex);
            if (hours.isEmpty() || !hours.get().isOpen()) {
                continue;
            }
            List<StaffingSlot> slots = context.staffingFor(dayIndex);
            if (slots.isEmpty()) {
                if (!hours.get().hasDuration()) {
                    warnings.add("Business hours for " + date + " open and close at the same time; day skipped");
                    continue;
                }
                fillDefaultCoverage(context, date, hours.get(), shifts, warnings, options);
            } else {
                for (StaffingSlot slot : slots) {
                    fillRequirement(context, date, slot, shifts, warnings, options);
                }
            }
        }

        if (shifts.isEmpty()) {
            warnings.add("No shifts could be generated for this week");
            warnings.add("Possible reasons:");
            warnings.add("- All employees may be unavailable during business hours");
            warnings.add("- Employees may have reached their max days/week limit");
            warnings.add("- Weekly hour limits may be preventing assignments");
            warnings.add("Try: Adjust employee availability, increase max days/week, or enable overtime");
        }

        ScheduleStats stats = scheduleValidator.calculateStats(shifts, context);
        warnings.addAll(scheduleValidator.fairnessWarnings(shifts, context));

        logger.info("Generated {} shifts ({} hours) with {} warnings for restaurant {}",
                stats.totalShifts(), stats.totalHours(), warnings.size(), context.restaurantId());
        return new GeneratedSchedule(shifts, new ArrayList<>(warnings), stats);
    }

    private void fillDefaultCoverage(SchedulerContext context,
                                     LocalDate date,
                                     OpeningHours hours,
                                     List<ScheduleShift> shifts,
                                     Set<String> warnings,
                                     GenerationOptions options) {
        for (int i = 0; i < settings.getDefaultCoverageHeadcount(); i++) {
            Optional<ScheduleShift> shift = assignBestEmployee(context, date, hours.openTime(), hours.closeTime(),
                    shifts, options);
            if (shift.isPresent()) {
                shifts.add(shift.get());
            } else {
                warnings.add("Could not find available staff for " + date);
            }
        }
    }

    private void fillRequirement(SchedulerContext context,
                                 LocalDate date,
                                 StaffingSlot slot,
                                 List<ScheduleShift> shifts,
                                 Set<String> warnings,
                                 GenerationOptions options) {
        if (!slot.hasDuration()) {
            warnings.add(String.format("Staffing slot %s %s-%s has no duration; slot skipped",
                    date, TimeRanges.format(slot.start()), TimeRanges.format(slot.end())));
            return;
        }
        for (int i = 0; i < slot.optimalStaff(); i++) {
            Optional<ScheduleShift> shift = assignBestEmployee(context, date, slot.start(), slot.end(), shifts, options);
            if (shift.isPresent()) {
                shifts.add(shift.get());
            } else if (i < slot.minStaffRequired()) {
                warnings.add(String.format("Could not meet minimum staffing (%d) for %s %s-%s",
                        slot.minStaffRequired(), date, TimeRanges.format(slot.start()), TimeRanges.format(slot.end())));
            }
        }
    }

    /**
     * Picks the best eligible employee for one slot, or empty when every employee fails a
     * hard constraint. An employee already holding this exact slot on {@code date} is never
     * picked again. {@code runShifts} is not modified.
     */
    public Optional<ScheduleShift> assignBestEmployee(SchedulerContext context,
                                                      LocalDate date,
                                                      LocalTime start,
                                                      LocalTime end,
                                                      List<ScheduleShift> runShifts,
                                                      GenerationOptions options) {
        double shiftHours = TimeRanges.durationHours(start, end);
        List<ScheduledWindow> restWindow = new ArrayList<>(runShifts);
        restWindow.addAll(context.carryOverShifts());

        StaffMember best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (StaffMember employee : context.employees()) {
            Long id = employee.id();
            if (holdsSlot(id, date, start, end, runShifts)) {
                continue;
            }
            if (!constraintChecker.isAvailable(id, date, start, end, context)) {
                continue;
            }
            if (!constraintChecker.isFreeOfOverlap(id, date, start, end, runShifts)) {
                continue;
            }
            if (!constraintChecker.hasAdequateRest(id, date, start, restWindow)) {
                continue;
            }
            if (constraintChecker.exceedsWeeklyHours(id, shiftHours, runShifts, options.allowOvertime())) {
                continue;
            }
            double score = candidateScorer.score(employee, date, start, end, context, runShifts, options);
            logger.debug("{} {}-{}: {} scored {}", date, start, end, employee.fullName(), score);
            if (best == null || score > bestScore) {
                best = employee;
                bestScore = score;
            }
        }

        if (best == null) {
            logger.debug("{} {}-{}: no eligible employee", date, start, end);
            return Optional.empty();
        }
        return Optional.of(new ScheduleShift(best.id(), date, start, end, best.position(), null));
    }

    private static boolean holdsSlot(Long employeeId,
                                     LocalDate date,
                                     LocalTime start,
                                     LocalTime end,
                                     List<ScheduleShift> runShifts) {
        return runShifts.stream().anyMatch(s -> s.employeeId().equals(employeeId)
                && s.shiftDate().equals(date)
                && s.startTime().equals(start)
                && s.endTime().equals(end));
    }
}
