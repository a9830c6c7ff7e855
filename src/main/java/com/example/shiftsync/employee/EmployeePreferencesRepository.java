package com.example.shiftsync.employee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface EmployeePreferencesRepository extends JpaRepository<EmployeePreferences, Long> {

    @Query("SELECT p FROM EmployeePreferences p JOIN FETCH p.employee e WHERE e.id IN :employeeIds")
    List<EmployeePreferences> findByEmployeeIds(@Param("employeeIds") Collection<Long> employeeIds);
}
