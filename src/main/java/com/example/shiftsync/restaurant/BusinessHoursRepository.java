package com.example.shiftsync.restaurant;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BusinessHoursRepository extends JpaRepository<BusinessHours, Long> {
    List<BusinessHours> findByRestaurantIdOrderByDayOfWeekAsc(Long restaurantId);
}
