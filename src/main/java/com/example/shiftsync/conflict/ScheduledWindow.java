package com.example.shiftsync.conflict;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Anything occupying an employee for a time range on a date: persisted shifts as well as
 * shifts still being generated (which have no id yet).
 */
public interface ScheduledWindow {

    /** Persistent id, or {@code null} for shifts that are not stored yet. */
    Long id();

    Long employeeId();

    LocalDate shiftDate();

    LocalTime startTime();

    LocalTime endTime();
}
