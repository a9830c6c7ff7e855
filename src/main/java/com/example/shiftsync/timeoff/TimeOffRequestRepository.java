package com.example.shiftsync.timeoff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface TimeOffRequestRepository extends JpaRepository<TimeOffRequest, Long> {

    /**
     * Requests in the given status whose date range intersects [start, end].
     */
    @Query("SELECT t FROM TimeOffRequest t JOIN FETCH t.employee " +
           "WHERE t.restaurantId = :restaurantId AND t.status = :status " +
           "AND t.startDate <= :end AND t.endDate >= :start")
    List<TimeOffRequest> findOverlapping(@Param("restaurantId") Long restaurantId,
                                         @Param("status") TimeOffRequest.Status status,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end);

    default List<TimeOffRequest> findApprovedOverlapping(Long restaurantId, LocalDate start, LocalDate end) {
        return findOverlapping(restaurantId, TimeOffRequest.Status.APPROVED, start, end);
    }
}
