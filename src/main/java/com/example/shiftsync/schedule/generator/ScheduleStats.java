package com.example.shiftsync.schedule.generator;

public record ScheduleStats(int totalShifts,
                            double totalHours,
                            double estimatedLaborCost,
                            int employeesScheduled,
                            double fairnessScore) {

    public static ScheduleStats empty() {
        return new ScheduleStats(0, 0, 0, 0, 0);
    }
}
