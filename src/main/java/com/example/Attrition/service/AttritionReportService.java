package com.example.Attrition.service;

import com.example.Attrition.exception.CustomException;
import com.example.Attrition.model.CompanyRiskReport;
import com.example.Attrition.model.Employee;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.model.RiskLevel;
import com.example.Attrition.model.RiskSummary;
import com.example.Attrition.store.AttendanceStore;
import com.example.Attrition.store.ReportStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Builds company-wide attrition reports. Employees are scored independently on the
 * scoring executor; results are gathered in discovery order and then stable-sorted by
 * score, so the output does not depend on which task finishes first.
 */
@Slf4j
@Service
public class AttritionReportService {

    private final AttendanceStore attendanceStore;
    private final ReportStore reportStore;
    private final AttritionRiskService riskService;
    private final Executor scoringExecutor;
    private final Clock clock;
    private final int historySize;

    public AttritionReportService(AttendanceStore attendanceStore,
                                  ReportStore reportStore,
                                  AttritionRiskService riskService,
                                  @Qualifier("riskScoringExecutor") Executor scoringExecutor,
                                  Clock clock,
                                  @Value("${attrition.report.history-size:10}") int historySize) {
        this.attendanceStore = attendanceStore;
        this.reportStore = reportStore;
        this.riskService = riskService;
        this.scoringExecutor = scoringExecutor;
        this.clock = clock;
        this.historySize = historySize;
    }

    public CompanyRiskReport generateReport(String organizationId, int months) {
        if (months < 1) {
            throw new CustomException("months must be at least 1", HttpStatus.BAD_REQUEST);
        }
        List<Employee> employees = attendanceStore.findEmployees(organizationId);
        log.info("Generating attrition report for organization {} over {} month(s), {} employee(s)",
                organizationId, months, employees.size());

        List<CompletableFuture<RiskAssessment>> tasks = employees.stream()
                .map(employee -> CompletableFuture
                        .supplyAsync(() -> riskService.assess(employee, months), scoringExecutor)
                        .exceptionally(ex -> {
                            log.warn("Error calculating risk for employee {}, excluded from report",
                                    employee.getEmployeeId(), ex);
                            return null;
                        }))
                .toList();

        List<RiskAssessment> results = tasks.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));

        // List.sort is stable: equal scores keep discovery order
        results.sort(Comparator.comparingDouble(RiskAssessment::getScore).reversed());

        return CompanyRiskReport.builder()
                .organizationId(organizationId)
                .period(months)
                .periodLabel(months + " months")
                .totalEmployees(employees.size())
                .summary(summarize(results))
                .employees(results)
                .generatedAt(Instant.now(clock))
                .build();
    }

    public CompanyRiskReport generateAndStoreReport(String organizationId, int months) {
        CompanyRiskReport saved = reportStore.save(generateReport(organizationId, months));
        log.info("Stored attrition report {} for organization {}", saved.getId(), organizationId);
        return saved;
    }

    /**
     * Employees of an existing report scoring at or above {@code threshold}, in report order.
     */
    public List<RiskAssessment> highRisk(CompanyRiskReport report, double threshold) {
        return report.getEmployees().stream()
                .filter(assessment -> assessment.getScore() >= threshold)
                .toList();
    }

    public List<CompanyRiskReport> history(String organizationId) {
        return reportStore.findRecent(organizationId, historySize);
    }

    static RiskSummary summarize(List<RiskAssessment> results) {
        return RiskSummary.builder()
                .high(countLevel(results, RiskLevel.HIGH))
                .moderate(countLevel(results, RiskLevel.MODERATE))
                .low(countLevel(results, RiskLevel.LOW))
                .insufficientData(countLevel(results, RiskLevel.INSUFFICIENT_DATA))
                .build();
    }

    private static int countLevel(List<RiskAssessment> results, RiskLevel level) {
        return (int) results.stream().filter(r -> r.getRiskLevel() == level).count();
    }
}
