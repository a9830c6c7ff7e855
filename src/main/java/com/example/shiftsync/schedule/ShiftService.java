package com.example.shiftsync.schedule;

import com.example.shiftsync.conflict.ConflictDetector;
import com.example.shiftsync.conflict.ShiftConflict;
import com.example.shiftsync.conflict.ShiftValidation;
import com.example.shiftsync.employee.Employee;
import com.example.shiftsync.exception.BusinessException;
import com.example.shiftsync.schedule.generator.ExistingShift;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Manual shift entry and review of stored weeks.
 */
@Service
public class ShiftService {
    private static final Logger logger = LoggerFactory.getLogger(ShiftService.class);

    private final ShiftRepository shiftRepository;
    private final ConflictDetector conflictDetector;

    public ShiftService(ShiftRepository shiftRepository, ConflictDetector conflictDetector) {
        this.shiftRepository = shiftRepository;
        this.conflictDetector = conflictDetector;
    }

    @Transactional
    public Shift create(ShiftRequest request, Employee employee) {
        ensureSameRestaurant(request, employee);
        ensureValid(request, employee, null);
        Shift shift = new Shift(request.restaurantId(), employee, request.shiftDate(),
                request.startTime(), request.endTime());
        shift.setPosition(request.position() != null ? request.position() : employee.getPosition());
        shift.setNotes(request.notes());
        Shift saved = shiftRepository.save(shift);
        logger.info("Created shift {} for employee {} on {}", saved.getId(), employee.getId(), saved.getShiftDate());
        return saved;
    }

    @Transactional
    public Shift update(Shift shift, ShiftRequest request, Employee employee) {
        ensureSameRestaurant(request, employee);
        ensureValid(request, employee, shift.getId());
        shift.setEmployee(employee);
        shift.setShiftDate(request.shiftDate());
        shift.setStartTime(request.startTime());
        shift.setEndTime(request.endTime());
        if (request.position() != null) {
            shift.setPosition(request.position());
        }
        shift.setNotes(request.notes());
        return shiftRepository.save(shift);
    }

    @Transactional(readOnly = true)
    public List<Shift> list(Long restaurantId, LocalDate start, LocalDate end) {
        return shiftRepository.findWithEmployeeBetween(restaurantId, start, end);
    }

    /**
     * Conflicts among stored shifts in the range, one report per shift that has any.
     */
    @Transactional(readOnly = true)
    public List<ShiftConflictReport> conflicts(Long restaurantId, LocalDate start, LocalDate end) {
        List<ExistingShift> shifts = list(restaurantId, start, end).stream()
                .map(ExistingShift::from)
                .toList();
        Map<Long, List<ShiftConflict>> conflictMap = conflictDetector.getAllConflicts(shifts);
        return conflictMap.entrySet().stream()
                .map(e -> new ShiftConflictReport(e.getKey(),
                        conflictDetector.getConflictSeverity(e.getValue()),
                        conflictDetector.formatConflictMessage(e.getValue()),
                        e.getValue()))
                .toList();
    }

    private void ensureSameRestaurant(ShiftRequest request, Employee employee) {
        if (!request.restaurantId().equals(employee.getRestaurantId())) {
            throw new BusinessException("EMPLOYEE_RESTAURANT_MISMATCH",
                    "Employee " + employee.getId() + " does not belong to restaurant " + request.restaurantId());
        }
    }

    private void ensureValid(ShiftRequest request, Employee employee, Long excludeShiftId) {
        List<ExistingShift> sameDay = shiftRepository.findByEmployeeAndDate(employee.getId(), request.shiftDate())
                .stream()
                .map(ExistingShift::from)
                .toList();
        ShiftValidation validation = conflictDetector.isShiftValid(employee.getId(), request.shiftDate(),
                request.startTime(), request.endTime(), sameDay, excludeShiftId);
        if (validation.valid()) {
            return;
        }
        List<ShiftConflict> conflicts = request.startTime() == null || request.endTime() == null
                ? List.of()
                : conflictDetector.detectConflicts(employee.getId(), request.shiftDate(),
                        request.startTime(), request.endTime(), sameDay, excludeShiftId);
        if (!conflicts.isEmpty()) {
            throw new BusinessException("SHIFT_CONFLICT", conflictDetector.formatConflictMessage(conflicts));
        }
        throw new BusinessException("INVALID_SHIFT", String.join("; ", validation.errors()));
    }
}
