package com.example.shiftsync.conflict;

public record ShiftConflict(ScheduledWindow shift, ConflictType conflictType, String message) {
}
