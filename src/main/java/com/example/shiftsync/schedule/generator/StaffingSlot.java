package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.restaurant.StaffingRequirement;

import java.time.LocalTime;

public record StaffingSlot(int dayOfWeek, LocalTime start, LocalTime end, int minStaffRequired, int optimalStaff) {

    public static StaffingSlot from(StaffingRequirement requirement) {
        return new StaffingSlot(
                requirement.getDayOfWeek(),
                requirement.getTimeSlotStart(),
                requirement.getTimeSlotEnd(),
                requirement.getMinStaffRequired() == null ? 0 : requirement.getMinStaffRequired(),
                requirement.getOptimalStaff() == null ? 0 : requirement.getOptimalStaff());
    }

    public boolean hasDuration() {
        return !start.equals(end);
    }
}
