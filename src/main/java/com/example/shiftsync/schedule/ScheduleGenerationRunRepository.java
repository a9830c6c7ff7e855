package com.example.shiftsync.schedule;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScheduleGenerationRunRepository extends JpaRepository<ScheduleGenerationRun, Long> {
    List<ScheduleGenerationRun> findByRestaurantIdOrderByCreatedAtDescIdDesc(Long restaurantId);
}
