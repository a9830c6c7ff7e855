package com.example.shiftsync.employee;

import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A window in which the employee can NOT work. Recurring blocks repeat weekly on
 * {@code dayOfWeek} (Monday=0); one-off blocks apply to {@code specificDate} only.
 */
@Entity
@Table(name = "employee_availability")
public class EmployeeAvailability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "employee_id", nullable = false)
    private Employee employee;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Min(0)
    @Max(6)
    @Column(name = "day_of_week")
    private Integer dayOfWeek;

    @Column(name = "specific_date")
    private LocalDate specificDate;

    @Column(name = "unavailable_start_time")
    private LocalTime unavailableStartTime;

    @Column(name = "unavailable_end_time")
    private LocalTime unavailableEndTime;

    @Column(name = "is_all_day", nullable = false)
    private Boolean allDay = false;

    @Column(name = "is_recurring", nullable = false)
    private Boolean recurring = true;

    @Column(length = 200)
    private String reason;

    protected EmployeeAvailability() {
    }

    public static EmployeeAvailability recurring(Employee employee, int dayOfWeek, LocalTime start, LocalTime end) {
        EmployeeAvailability a = new EmployeeAvailability();
        a.employee = employee;
        a.restaurantId = employee.getRestaurantId();
        a.dayOfWeek = dayOfWeek;
        a.recurring = true;
        a.allDay = start == null || end == null;
        a.unavailableStartTime = start;
        a.unavailableEndTime = end;
        return a;
    }

    public static EmployeeAvailability onDate(Employee employee, LocalDate date, LocalTime start, LocalTime end) {
        EmployeeAvailability a = new EmployeeAvailability();
        a.employee = employee;
        a.restaurantId = employee.getRestaurantId();
        a.specificDate = date;
        a.recurring = false;
        a.allDay = start == null || end == null;
        a.unavailableStartTime = start;
        a.unavailableEndTime = end;
        return a;
    }

    public Long getId() { return id; }
    public Employee getEmployee() { return employee; }
    public Long getRestaurantId() { return restaurantId; }
    public Integer getDayOfWeek() { return dayOfWeek; }
    public void setDayOfWeek(Integer dayOfWeek) { this.dayOfWeek = dayOfWeek; }
    public LocalDate getSpecificDate() { return specificDate; }
    public void setSpecificDate(LocalDate specificDate) { this.specificDate = specificDate; }
    public LocalTime getUnavailableStartTime() { return unavailableStartTime; }
    public void setUnavailableStartTime(LocalTime unavailableStartTime) { this.unavailableStartTime = unavailableStartTime; }
    public LocalTime getUnavailableEndTime() { return unavailableEndTime; }
    public void setUnavailableEndTime(LocalTime unavailableEndTime) { this.unavailableEndTime = unavailableEndTime; }
    public Boolean getAllDay() { return allDay; }
    public void setAllDay(Boolean allDay) { this.allDay = allDay; }
    public Boolean getRecurring() { return recurring; }
    public void setRecurring(Boolean recurring) { this.recurring = recurring; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }
}
