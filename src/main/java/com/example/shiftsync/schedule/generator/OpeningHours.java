package com.example.shiftsync.schedule.generator;

import com.example.shiftsync.restaurant.BusinessHours;

import java.time.LocalTime;

public record OpeningHours(int dayOfWeek, LocalTime openTime, LocalTime closeTime, boolean closed) {

    public static OpeningHours from(BusinessHours hours) {
        return new OpeningHours(hours.getDayOfWeek(), hours.getOpenTime(), hours.getCloseTime(),
                Boolean.TRUE.equals(hours.getClosed()));
    }

    public boolean isOpen() {
        return !closed;
    }

    public boolean hasDuration() {
        return !openTime.equals(closeTime);
    }
}
