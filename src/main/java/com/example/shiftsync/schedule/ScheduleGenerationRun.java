package com.example.shiftsync.schedule;

import jakarta.persistence.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Audit record of one published generation: the options used, resulting totals and warnings.
 */
@Entity
@Table(name = "schedule_generation_runs")
public class ScheduleGenerationRun {
    public enum Status { DRAFT, PUBLISHED, ARCHIVED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "week_start_date", nullable = false)
    private LocalDate weekStartDate;

    // JSON object of the generation options
    @Lob
    @Column(name = "generation_params")
    private String generationParams;

    @Column(name = "total_shifts", nullable = false)
    private Integer totalShifts = 0;

    @Column(name = "total_hours")
    private Double totalHours;

    @Column(name = "estimated_labor_cost")
    private Double estimatedLaborCost;

    // JSON array of warning messages
    @Lob
    @Column(name = "warnings")
    private String warnings;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private Status status = Status.DRAFT;

    @Column(name = "generated_by")
    private String generatedBy;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    protected ScheduleGenerationRun() {
    }

    public ScheduleGenerationRun(Long restaurantId, LocalDate weekStartDate) {
        this.restaurantId = restaurantId;
        this.weekStartDate = weekStartDate;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public void publish() {
        this.status = Status.PUBLISHED;
        this.publishedAt = LocalDateTime.now();
    }

    public Long getId() { return id; }
    public Long getRestaurantId() { return restaurantId; }
    public LocalDate getWeekStartDate() { return weekStartDate; }
    public String getGenerationParams() { return generationParams; }
    public void setGenerationParams(String generationParams) { this.generationParams = generationParams; }
    public Integer getTotalShifts() { return totalShifts; }
    public void setTotalShifts(Integer totalShifts) { this.totalShifts = totalShifts; }
    public Double getTotalHours() { return totalHours; }
    public void setTotalHours(Double totalHours) { this.totalHours = totalHours; }
    public Double getEstimatedLaborCost() { return estimatedLaborCost; }
    public void setEstimatedLaborCost(Double estimatedLaborCost) { this.estimatedLaborCost = estimatedLaborCost; }
    public String getWarnings() { return warnings; }
    public void setWarnings(String warnings) { this.warnings = warnings; }
    public Status getStatus() { return status; }
    public String getGeneratedBy() { return generatedBy; }
    public void setGeneratedBy(String generatedBy) { this.generatedBy = generatedBy; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getPublishedAt() { return publishedAt; }
}
