package com.example.shiftsync.restaurant;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StaffingRequirementRepository extends JpaRepository<StaffingRequirement, Long> {
    List<StaffingRequirement> findByRestaurantIdOrderByDayOfWeekAscTimeSlotStartAsc(Long restaurantId);
}
