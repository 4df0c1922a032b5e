package com.example.Attrition.service;

import com.example.Attrition.exception.CustomException;
import com.example.Attrition.exception.EmployeeNotFoundException;
import com.example.Attrition.model.AttendanceRecord;
import com.example.Attrition.model.Employee;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.scoring.RiskScoringEngine;
import com.example.Attrition.store.AttendanceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AttritionRiskService {

    private final AttendanceStore attendanceStore;
    private final RiskScoringEngine scoringEngine;
    private final Clock clock;

    public RiskAssessment assess(String organizationId, String employeeId, int months) {
        Employee employee = attendanceStore.findEmployee(organizationId, employeeId)
                .orElseThrow(() -> new EmployeeNotFoundException(employeeId));
        return assess(employee, months);
    }

    /**
     * Scores the employee over {@code [today - months, today]}, both ends inclusive.
     */
    public RiskAssessment assess(Employee employee, int months) {
        if (months < 1) {
            throw new CustomException("months must be at least 1", HttpStatus.BAD_REQUEST);
        }
        LocalDate today = LocalDate.now(clock);
        List<AttendanceRecord> records = attendanceStore.findRecords(
                employee.getOrganizationId(), employee.getEmployeeId(), today.minusMonths(months), today);

        RiskAssessment assessment = scoringEngine.score(employee, records);
        log.debug("Scored employee {} over {} record(s): {} ({})",
                employee.getEmployeeId(), records.size(), assessment.getScore(), assessment.getRiskLevel());
        return assessment;
    }
}
