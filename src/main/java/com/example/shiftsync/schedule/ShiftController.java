package com.example.shiftsync.schedule;

import com.example.shiftsync.common.ApiResponse;
import com.example.shiftsync.employee.Employee;
import com.example.shiftsync.employee.EmployeeRepository;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final ShiftService shiftService;
    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;

    public ShiftController(ShiftService shiftService,
                           ShiftRepository shiftRepository,
                           EmployeeRepository employeeRepository) {
        this.shiftService = shiftService;
        this.shiftRepository = shiftRepository;
        this.employeeRepository = employeeRepository;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftDto>>> list(@RequestParam("restaurantId") Long restaurantId,
                                                            @RequestParam("start") LocalDate start,
                                                            @RequestParam("end") LocalDate end) {
        List<ShiftDto> data = shiftService.list(restaurantId, start, end).stream()
                .map(ShiftDto::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(data));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftDto>> create(@Valid @RequestBody ShiftRequest request) {
        Optional<Employee> employee = employeeRepository.findById(request.employeeId());
        if (employee.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Employee not found"));
        }
        Shift saved = shiftService.create(request, employee.get());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Shift created", ShiftDto.from(saved)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftDto>> update(@PathVariable Long id, @Valid @RequestBody ShiftRequest request) {
        Optional<Shift> shift = shiftRepository.findById(id);
        if (shift.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Shift not found"));
        }
        Optional<Employee> employee = employeeRepository.findById(request.employeeId());
        if (employee.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.failure("Employee not found"));
        }
        Shift saved = shiftService.update(shift.get(), request, employee.get());
        return ResponseEntity.ok(ApiResponse.success("Shift updated", ShiftDto.from(saved)));
    }

    @GetMapping("/conflicts")
    public ResponseEntity<ApiResponse<List<ShiftConflictReport>>> conflicts(@RequestParam("restaurantId") Long restaurantId,
                                                                            @RequestParam("start") LocalDate start,
                                                                            @RequestParam("end") LocalDate end) {
        List<ShiftConflictReport> reports = shiftService.conflicts(restaurantId, start, end);
        return ResponseEntity.ok(ApiResponse.success(null, reports, Map.of("conflictingShifts", reports.size())));
    }
}
