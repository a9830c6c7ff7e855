package com.example.shiftsync.exception;

/**
 * Raised when a generation run fails for a reason other than missing configuration.
 * "Nothing to schedule" is reported through warnings, never through this exception.
 */
public class ScheduleGenerationException extends RuntimeException {

    private final String errorCode;

    public ScheduleGenerationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "SCHEDULE_GENERATION_ERROR";
    }

    public ScheduleGenerationException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
