package com.example.shiftsync.schedule;

import com.example.shiftsync.schedule.generator.GenerationOptions;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record ScheduleGenerateRequest(
        @NotNull Long restaurantId,
        @NotNull LocalDate weekStartDate,
        Boolean prioritizeFairness,
        Boolean prioritizeCost,
        Boolean allowOvertime
) {
    public GenerationOptions toOptions() {
        return new GenerationOptions(
                !Boolean.FALSE.equals(prioritizeFairness),
                Boolean.TRUE.equals(prioritizeCost),
                Boolean.TRUE.equals(allowOvertime));
    }
}
