package com.example.shiftsync.conflict;

import java.util.List;

public record ShiftValidation(boolean valid, List<String> errors) {
    public ShiftValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
