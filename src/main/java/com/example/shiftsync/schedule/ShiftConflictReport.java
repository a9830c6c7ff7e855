package com.example.shiftsync.schedule;

import com.example.shiftsync.conflict.ConflictSeverity;
import com.example.shiftsync.conflict.ShiftConflict;

import java.util.List;

public record ShiftConflictReport(Long shiftId, ConflictSeverity severity, String message, List<ShiftConflict> conflicts) {
}
