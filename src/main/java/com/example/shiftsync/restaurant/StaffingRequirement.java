package com.example.shiftsync.restaurant;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalTime;

@Entity
@Table(name = "staffing_requirements")
public class StaffingRequirement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Min(0)
    @Max(6)
    @Column(name = "day_of_week", nullable = false)
    private Integer dayOfWeek;

    @NotNull
    @Column(name = "time_slot_start", nullable = false)
    private LocalTime timeSlotStart;

    @NotNull
    @Column(name = "time_slot_end", nullable = false)
    private LocalTime timeSlotEnd;

    @Min(value = 0, message = "Minimum staff cannot be negative")
    @Column(name = "min_staff_required", nullable = false)
    private Integer minStaffRequired = 1;

    @Min(value = 0, message = "Optimal staff cannot be negative")
    @Max(value = 20, message = "Optimal staff must be 20 or fewer")
    @Column(name = "optimal_staff", nullable = false)
    private Integer optimalStaff = 2;

    protected StaffingRequirement() {
    }

    public StaffingRequirement(Long restaurantId, Integer dayOfWeek, LocalTime timeSlotStart, LocalTime timeSlotEnd,
                               Integer minStaffRequired, Integer optimalStaff) {
        this.restaurantId = restaurantId;
        this.dayOfWeek = dayOfWeek;
        this.timeSlotStart = timeSlotStart;
        this.timeSlotEnd = timeSlotEnd;
        this.minStaffRequired = minStaffRequired;
        this.optimalStaff = optimalStaff;
    }

    public Long getId() { return id; }
    public Long getRestaurantId() { return restaurantId; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public LocalTime getTimeSlotStart() { return timeSlotStart; }
    public LocalTime getTimeSlotEnd() { return timeSlotEnd; }
    public Integer getMinStaffRequired() { return minStaffRequired; }
    public void setMinStaffRequired(Integer minStaffRequired) { this.minStaffRequired = minStaffRequired; }
    public Integer getOptimalStaff() { return optimalStaff; }
    public void setOptimalStaff(Integer optimalStaff) { this.optimalStaff = optimalStaff; }
}
