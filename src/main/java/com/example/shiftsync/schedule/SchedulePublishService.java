package com.example.shiftsync.schedule;

import com.example.shiftsync.conflict.ConflictDetector;
import com.example.shiftsync.conflict.ShiftConflict;
import com.example.shiftsync.employee.Employee;
import com.example.shiftsync.employee.EmployeeRepository;
import com.example.shiftsync.exception.BusinessException;
import com.example.shiftsync.exception.ScheduleGenerationException;
import com.example.shiftsync.schedule.generator.ExistingShift;
import com.example.shiftsync.schedule.generator.GenerationOptions;
import com.example.shiftsync.schedule.generator.ScheduleShift;
import com.example.shiftsync.schedule.generator.ScheduleStats;
import com.example.shiftsync.schedule.generator.ScheduleValidator;
import com.example.shiftsync.schedule.generator.StaffMember;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Stores a reviewed schedule: one audit row for the run plus the shifts, in one transaction.
 */
@Service
public class SchedulePublishService {
    private static final Logger logger = LoggerFactory.getLogger(SchedulePublishService.class);
    private static final ObjectMapper RUN_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<String>> WARNINGS_TYPE = new TypeReference<>() {
    };

    private final ShiftRepository shiftRepository;
    private final ScheduleGenerationRunRepository runRepository;
    private final EmployeeRepository employeeRepository;
    private final ConflictDetector conflictDetector;
    private final ScheduleValidator scheduleValidator;

    public SchedulePublishService(ShiftRepository shiftRepository,
                                  ScheduleGenerationRunRepository runRepository,
                                  EmployeeRepository employeeRepository,
                                  ConflictDetector conflictDetector,
                                  ScheduleValidator scheduleValidator) {
        this.shiftRepository = shiftRepository;
        this.runRepository = runRepository;
        this.employeeRepository = employeeRepository;
        this.conflictDetector = conflictDetector;
        this.scheduleValidator = scheduleValidator;
    }

    @Transactional
    public ScheduleRunDto publish(SchedulePublishRequest request) {
        Long restaurantId = request.restaurantId();
        List<ScheduleShift> shifts = request.shifts().stream()
                .map(s -> new ScheduleShift(s.employeeId(), s.shiftDate(), s.startTime(), s.endTime(),
                        s.position(), s.notes()))
                .toList();

        Map<Long, Employee> employees = resolveEmployees(restaurantId, shifts);
        ensureNoConflicts(restaurantId, shifts);

        List<StaffMember> staff = employees.values().stream().map(StaffMember::from).toList();
        ScheduleStats stats = scheduleValidator.calculateStats(shifts, staff);

        ScheduleGenerationRun run = new ScheduleGenerationRun(restaurantId, request.weekStartDate());
        run.setGenerationParams(toJson(request.options() != null ? request.options() : GenerationOptions.defaults()));
        run.setTotalShifts(stats.totalShifts());
        run.setTotalHours(stats.totalHours());
        run.setEstimatedLaborCost(stats.estimatedLaborCost());
        List<String> warnings = request.warnings() == null ? List.of() : request.warnings();
        run.setWarnings(toJson(warnings));
        run.setGeneratedBy(request.generatedBy());
        run.publish();
        ScheduleGenerationRun saved = runRepository.save(run);

        List<Shift> entities = new ArrayList<>();
        for (ScheduleShift shift : shifts) {
            Shift entity = new Shift(restaurantId, employees.get(shift.employeeId()), shift.shiftDate(),
                    shift.startTime(), shift.endTime());
            entity.setPosition(shift.position());
            entity.setNotes(shift.notes());
            entities.add(entity);
        }
        shiftRepository.saveAll(entities);

        logger.info("Published {} shifts for restaurant {} week {} (run {})",
                entities.size(), restaurantId, request.weekStartDate(), saved.getId());
        return ScheduleRunDto.from(saved, warnings);
    }

    @Transactional(readOnly = true)
    public List<ScheduleRunDto> listRuns(Long restaurantId) {
        return runRepository.findByRestaurantIdOrderByCreatedAtDescIdDesc(restaurantId).stream()
                .map(run -> ScheduleRunDto.from(run, parseWarnings(run.getWarnings())))
                .toList();
    }

    private Map<Long, Employee> resolveEmployees(Long restaurantId, List<ScheduleShift> shifts) {
        List<Long> ids = shifts.stream().map(ScheduleShift::employeeId).distinct().toList();
        Map<Long, Employee> employees = employeeRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));
        for (Long id : ids) {
            Employee employee = employees.get(id);
            if (employee == null) {
                throw new BusinessException("EMPLOYEE_NOT_FOUND", "Employee not found: " + id);
            }
            if (!restaurantId.equals(employee.getRestaurantId())) {
                throw new BusinessException("EMPLOYEE_RESTAURANT_MISMATCH",
                        "Employee " + id + " does not belong to restaurant " + restaurantId);
            }
        }
        return employees;
    }

    private void ensureNoConflicts(Long restaurantId, List<ScheduleShift> shifts) {
        LocalDate from = shifts.stream().map(ScheduleShift::shiftDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate to = shifts.stream().map(ScheduleShift::shiftDate).max(Comparator.naturalOrder()).orElseThrow();
        List<ExistingShift> stored = shiftRepository.findWithEmployeeBetween(restaurantId, from, to).stream()
                .map(ExistingShift::from)
                .toList();

        for (int i = 0; i < shifts.size(); i++) {
            ScheduleShift shift = shifts.get(i);
            if (shift.startTime().equals(shift.endTime())) {
                throw new BusinessException("INVALID_SHIFT",
                        "Shift for employee " + shift.employeeId() + " on " + shift.shiftDate()
                                + ": Start time cannot be the same as end time");
            }
            List<ShiftConflict> conflicts = new ArrayList<>(conflictDetector.detectConflicts(shift.employeeId(),
                    shift.shiftDate(), shift.startTime(), shift.endTime(), stored, null));
            conflicts.addAll(conflictDetector.detectConflicts(shift.employeeId(), shift.shiftDate(),
                    shift.startTime(), shift.endTime(), shifts.subList(0, i), null));
            if (!conflicts.isEmpty()) {
                throw new BusinessException("PUBLISH_CONFLICT",
                        "Shift for employee " + shift.employeeId() + " on " + shift.shiftDate() + ": "
                                + conflictDetector.formatConflictMessage(conflicts));
            }
        }
    }

    private String toJson(Object value) {
        try {
            return RUN_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ScheduleGenerationException("RUN_AUDIT_ERROR", "Failed to serialize run details", e);
        }
    }

    private List<String> parseWarnings(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<String> warnings = RUN_MAPPER.readValue(raw, WARNINGS_TYPE);
            return warnings == null ? Collections.emptyList() : warnings;
        } catch (Exception e) {
            logger.warn("Failed to parse stored run warnings", e);
            return Collections.emptyList();
        }
    }
}
