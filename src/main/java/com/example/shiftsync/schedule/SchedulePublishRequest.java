package com.example.shiftsync.schedule;

import com.example.shiftsync.schedule.generator.GenerationOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * A reviewed schedule sent back for storage, usually the output of a generate call.
 */
public record SchedulePublishRequest(
        @NotNull Long restaurantId,
        @NotNull LocalDate weekStartDate,
        GenerationOptions options,
        @NotEmpty List<@Valid PublishedShift> shifts,
        List<String> warnings,
        String generatedBy
) {
    public record PublishedShift(
            @NotNull Long employeeId,
            @NotNull LocalDate shiftDate,
            @NotNull LocalTime startTime,
            @NotNull LocalTime endTime,
            String position,
            String notes
    ) {
    }
}
