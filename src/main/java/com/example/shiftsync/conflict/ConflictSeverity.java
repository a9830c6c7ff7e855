package com.example.shiftsync.conflict;

public enum ConflictSeverity {
    NONE,
    WARNING,
    ERROR
}
