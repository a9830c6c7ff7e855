package com.example.shiftsync.employee;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalDateTime;
import java.time.LocalTime;

@Entity
@Table(name = "employee_preferences")
public class EmployeePreferences {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", unique = true, nullable = false)
    private Employee employee;

    @Min(value = 40, message = "Target monthly hours must be at least 40")
    @Max(value = 200, message = "Target monthly hours must be at most 200")
    @Column(name = "target_monthly_hours", nullable = false)
    private Integer targetMonthlyHours = 160; // 40h/week * 4 weeks

    @Column(name = "preferred_shift_start_time")
    private LocalTime preferredShiftStartTime;

    @DecimalMin("4.0")
    @DecimalMax("12.0")
    @Column(name = "preferred_shift_length_hours")
    private Double preferredShiftLengthHours;

    @Min(1)
    @Max(7)
    @Column(name = "max_days_per_week", nullable = false)
    private Integer maxDaysPerWeek = 6;

    @Column(name = "prefers_weekends", nullable = false)
    private Boolean prefersWeekends = true;

    @Column(length = 500)
    private String notes;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected EmployeePreferences() {
    }

    public EmployeePreferences(Employee employee) {
        this.employee = employee;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public void setEmployee(Employee employee) { this.employee = employee; }
    public Integer getTargetMonthlyHours() { return targetMonthlyHours; }
    public void setTargetMonthlyHours(Integer targetMonthlyHours) { this.targetMonthlyHours = targetMonthlyHours; }
    public LocalTime getPreferredShiftStartTime() { return preferredShiftStartTime; }
    public void setPreferredShiftStartTime(LocalTime preferredShiftStartTime) { this.preferredShiftStartTime = preferredShiftStartTime; }
    public Double getPreferredShiftLengthHours() { return preferredShiftLengthHours; }
    public void setPreferredShiftLengthHours(Double preferredShiftLengthHours) { this.preferredShiftLengthHours = preferredShiftLengthHours; }
    public Integer getMaxDaysPerWeek() { return maxDaysPerWeek; }
    public void setMaxDaysPerWeek(Integer maxDaysPerWeek) { this.maxDaysPerWeek = maxDaysPerWeek; }
    public Boolean getPrefersWeekends() { return prefersWeekends; }
    public void setPrefersWeekends(Boolean prefersWeekends) { this.prefersWeekends = prefersWeekends; }
    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
