package com.example.Attrition.repository;

import com.example.Attrition.model.AttendanceRecord;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface AttendanceRecordRepository extends MongoRepository<AttendanceRecord, String> {

    Optional<AttendanceRecord> findByOrganizationIdAndEmployeeIdAndDate(String organizationId, String employeeId, LocalDate date);

    // inclusive on both ends, derived "Between" is exclusive
    @Query("{ 'organizationId': ?0, 'employeeId': ?1, 'date': { $gte: ?2, $lte: ?3 } }")
    List<AttendanceRecord> findWindow(String organizationId, String employeeId, LocalDate from, LocalDate to, Sort sort);
}
