package com.example.shiftsync.conflict;

import com.example.shiftsync.common.TimeRanges;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Finds same-employee, same-date shifts whose times overlap. Used for manual shift entry,
 * for reviewing a stored week, and by the generator to keep one person out of two
 * overlapping slots.
 */
@Component
public class ConflictDetector {

    public List<ShiftConflict> detectConflicts(Long employeeId,
                                               LocalDate shiftDate,
                                               LocalTime startTime,
                                               LocalTime endTime,
                                               Collection<? extends ScheduledWindow> allShifts,
                                               Long excludeShiftId) {
        List<ShiftConflict> conflicts = new ArrayList<>();
        for (ScheduledWindow existing : allShifts) {
            if (excludeShiftId != null && Objects.equals(existing.id(), excludeShiftId)) {
                continue;
            }
            if (!Objects.equals(existing.employeeId(), employeeId) || !Objects.equals(existing.shiftDate(), shiftDate)) {
                continue;
            }
            if (TimeRanges.overlaps(startTime, endTime, existing.startTime(), existing.endTime())) {
                conflicts.add(new ShiftConflict(existing, ConflictType.TIME_OVERLAP,
                        "Time overlap with existing shift: " + TimeRanges.format(existing.startTime())
                                + " - " + TimeRanges.format(existing.endTime())));
            }
        }
        return conflicts;
    }

    public boolean hasConflicts(Long employeeId,
                                LocalDate shiftDate,
                                LocalTime startTime,
                                LocalTime endTime,
                                Collection<? extends ScheduledWindow> allShifts,
                                Long excludeShiftId) {
        return !detectConflicts(employeeId, shiftDate, startTime, endTime, allShifts, excludeShiftId).isEmpty();
    }

    /**
     * Pairwise check across a stored shift set, keyed by shift id. Shifts without
     * conflicts are absent from the result.
     */
    public Map<Long, List<ShiftConflict>> getAllConflicts(Collection<? extends ScheduledWindow> shifts) {
        Map<Long, List<ShiftConflict>> conflictMap = new LinkedHashMap<>();
        for (ScheduledWindow shift : shifts) {
            List<ShiftConflict> conflicts = detectConflicts(shift.employeeId(), shift.shiftDate(),
                    shift.startTime(), shift.endTime(), shifts, shift.id());
            if (!conflicts.isEmpty()) {
                conflictMap.put(shift.id(), conflicts);
            }
        }
        return conflictMap;
    }

    public ShiftValidation isShiftValid(Long employeeId,
                                        LocalDate shiftDate,
                                        LocalTime startTime,
                                        LocalTime endTime,
                                        Collection<? extends ScheduledWindow> allShifts,
                                        Long excludeShiftId) {
        List<String> errors = new ArrayList<>();
        if (startTime == null || endTime == null) {
            errors.add("Start time and end time are required");
            return new ShiftValidation(false, errors);
        }
        detectConflicts(employeeId, shiftDate, startTime, endTime, allShifts, excludeShiftId)
                .forEach(c -> errors.add(c.message()));
        if (startTime.equals(endTime)) {
            errors.add("Start time cannot be the same as end time");
        }
        return new ShiftValidation(errors.isEmpty(), errors);
    }

    public ConflictSeverity getConflictSeverity(List<ShiftConflict> conflicts) {
        if (conflicts == null || conflicts.isEmpty()) {
            return ConflictSeverity.NONE;
        }
        boolean overlap = conflicts.stream().anyMatch(c -> c.conflictType() == ConflictType.TIME_OVERLAP);
        return overlap ? ConflictSeverity.ERROR : ConflictSeverity.WARNING;
    }

    public String formatConflictMessage(List<ShiftConflict> conflicts) {
        if (conflicts == null || conflicts.isEmpty()) {
            return "";
        }
        if (conflicts.size() == 1) {
            return conflicts.get(0).message();
        }
        return conflicts.size() + " conflicts detected:\n" + conflicts.stream()
                .map(c -> "• " + c.message())
                .collect(Collectors.joining("\n"));
    }
}
