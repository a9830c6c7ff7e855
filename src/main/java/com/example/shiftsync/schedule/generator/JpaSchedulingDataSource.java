package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.employee.EmployeeAvailabilityRepository;
import com.example.shiftsync.employee.EmployeePreferencesRepository;
import com.example.shiftsync.employee.EmployeeRepository;
import com.example.shiftsync.restaurant.BusinessHoursRepository;
import com.example.shiftsync.restaurant.StaffingRequirementRepository;
import com.example.shiftsync.schedule.ShiftRepository;
import com.example.shiftsync.timeoff.TimeOffRequestRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Component
public class JpaSchedulingDataSource implements SchedulingDataSource {

    private final EmployeeRepository employeeRepository;
    private final EmployeePreferencesRepository preferencesRepository;
    private final EmployeeAvailabilityRepository availabilityRepository;
    private final BusinessHoursRepository businessHoursRepository;
    private final StaffingRequirementRepository staffingRequirementRepository;
    private final ShiftRepository shiftRepository;
    private final TimeOffRequestRepository timeOffRequestRepository;

    public JpaSchedulingDataSource(EmployeeRepository employeeRepository,
                                   EmployeePreferencesRepository preferencesRepository,
                                   EmployeeAvailabilityRepository availabilityRepository,
                                   BusinessHoursRepository businessHoursRepository,
                                   StaffingRequirementRepository staffingRequirementRepository,
                                   ShiftRepository shiftRepository,
                                   TimeOffRequestRepository timeOffRequestRepository) {
        this.employeeRepository = employeeRepository;
        this.preferencesRepository = preferencesRepository;
        this.availabilityRepository = availabilityRepository;
        this.businessHoursRepository = businessHoursRepository;
        this.staffingRequirementRepository = staffingRequirementRepository;
        this.shiftRepository = shiftRepository;
        this.timeOffRequestRepository = timeOffRequestRepository;
    }

    @Override
    public List<StaffMember> listEmployees(Long restaurantId) {
        return employeeRepository.findByRestaurantIdOrderByIdAsc(restaurantId).stream()
                .map(StaffMember::from)
                .toList();
    }

    @Override
    public List<PreferenceProfile> listPreferences(Collection<Long> employeeIds) {
        if (employeeIds.isEmpty()) {
            return List.of();
        }
        return preferencesRepository.findByEmployeeIds(employeeIds).stream()
                .map(PreferenceProfile::from)
                .toList();
    }

    @Override
    public List<AvailabilityBlock> listAvailability(Long restaurantId) {
        return availabilityRepository.findByRestaurantId(restaurantId).stream()
                .map(AvailabilityBlock::from)
                .toList();
    }

    @Override
    public List<OpeningHours> listBusinessHours(Long restaurantId) {
        return businessHoursRepository.findByRestaurantIdOrderByDayOfWeekAsc(restaurantId).stream()
                .map(OpeningHours::from)
                .toList();
    }

    @Override
    public List<StaffingSlot> listStaffingRequirements(Long restaurantId) {
        return staffingRequirementRepository.findByRestaurantIdOrderByDayOfWeekAscTimeSlotStartAsc(restaurantId).stream()
                .map(StaffingSlot::from)
                .toList();
    }

    @Override
    public List<ExistingShift> listShifts(Long restaurantId, LocalDate from, LocalDate to) {
        return shiftRepository.findWithEmployeeBetween(restaurantId, from, to).stream()
                .map(ExistingShift::from)
                .toList();
    }

    @Override
    public List<TimeOffWindow> listApprovedTimeOff(Long restaurantId, LocalDate from, LocalDate to) {
        return timeOffRequestRepository.findApprovedOverlapping(restaurantId, from, to).stream()
                .map(TimeOffWindow::from)
                .toList();
    }
}
