package com.example.shiftsync.schedule;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record ScheduleRunDto(
        Long id,
        Long restaurantId,
        LocalDate weekStartDate,
        Integer totalShifts,
        Double totalHours,
        Double estimatedLaborCost,
        List<String> warnings,
        ScheduleGenerationRun.Status status,
        String generatedBy,
        LocalDateTime createdAt,
        LocalDateTime publishedAt) {

    public static ScheduleRunDto from(ScheduleGenerationRun run, List<String> warnings) {
        return new ScheduleRunDto(
                run.getId(),
                run.getRestaurantId(),
                run.getWeekStartDate(),
                run.getTotalShifts(),
                run.getTotalHours(),
                run.getEstimatedLaborCost(),
                warnings,
                run.getStatus(),
                run.getGeneratedBy(),
                run.getCreatedAt(),
                run.getPublishedAt()
        );
    }
}
