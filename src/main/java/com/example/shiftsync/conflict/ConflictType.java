package com.example.shiftsync.conflict;

public enum ConflictType {
    TIME_OVERLAP,
    /** Reserved for non-overlapping rule conflicts; nothing produces it yet, severity maps it to WARNING. */
    SAME_EMPLOYEE
}
