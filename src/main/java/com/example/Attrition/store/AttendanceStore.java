package com.example.Attrition.store;

import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.Employee;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Attendance data as the upload and scoring code needs it. Implementations own
 * uniqueness of (organization, employee, date) and any concurrency control.
 */
public interface AttendanceStore {

    Optional<Employee> findEmployee(String organizationId, String employeeId);

    /**
     * All employees of the organization, in a stable order.
     */
    List<Employee> findEmployees(String organizationId);

    /**
     * Records of one employee with {@code from <= date <= to}, oldest first.
     */
    List<AttendanceRecord> findRecords(String organizationId, String employeeId, LocalDate from, LocalDate to);

    /**
     * Records matching the optional filters, newest first.
     */
    List<AttendanceRecord> searchRecords(String organizationId, String employeeId, LocalDate from, LocalDate to);

    /**
     * Inserts or replaces records by (organization, employee, date) and creates or refreshes
     * the employees they belong to.
     *
     * @return number of records written
     */
    int upsertRecords(String organizationId, List<AttendanceRecord> records);
}
