package com.example.shiftsync.schedule;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ShiftRepository extends JpaRepository<Shift, Long> {

    /**
     * Shifts of a restaurant in the given date range, employee fetched eagerly.
     */
    @Query("SELECT s FROM Shift s JOIN FETCH s.employee " +
           "WHERE s.restaurantId = :restaurantId AND s.shiftDate BETWEEN :startDate AND :endDate " +
           "ORDER BY s.shiftDate, s.startTime")
    List<Shift> findWithEmployeeBetween(@Param("restaurantId") Long restaurantId,
                                        @Param("startDate") LocalDate startDate,
                                        @Param("endDate") LocalDate endDate);

    /**
     * Shifts of one employee on one date.
     */
    @Query("SELECT s FROM Shift s JOIN FETCH s.employee e WHERE e.id = :employeeId AND s.shiftDate = :shiftDate")
    List<Shift> findByEmployeeAndDate(@Param("employeeId") Long employeeId, @Param("shiftDate") LocalDate shiftDate);
}
