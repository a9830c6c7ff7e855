package com.example.shiftsync.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EmployeeAvailabilityRepository extends JpaRepository<EmployeeAvailability, Long> {

    @Query("SELECT a FROM EmployeeAvailability a JOIN FETCH a.employee WHERE a.restaurantId = :restaurantId")
    List<EmployeeAvailability> findByRestaurantId(@Param("restaurantId") Long restaurantId);
}
