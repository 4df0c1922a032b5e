package com.example.Attrition.service;

import com.example.Attrition.exception.CustomException;
import com.example.Attrition.model.AttendanceStatus;
import com.example.Attrition.model.CompanyRiskReport;
import com.example.Attrition.model.Employee;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.model.RiskLevel;
import com.example.Attrition.scoring.RiskScoringEngine;
import com.example.Attrition.support.InMemoryAttendanceStore;
import com.example.Attrition.support.InMemoryReportStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.example.Attrition.model.AttendanceStatus.*;
import static com.example.Attrition.support.AttendanceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@DisplayName("AttritionReportService")
class AttritionReportServiceTest {

    // records start 2024-01-01, so a 3 month window ending here covers all of them
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-29T12:00:00Z"), ZoneOffset.UTC);

    private InMemoryAttendanceStore attendanceStore;
    private InMemoryReportStore reportStore;
    private AttritionRiskService riskService;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        attendanceStore = new InMemoryAttendanceStore();
        reportStore = new InMemoryReportStore();
        riskService = new AttritionRiskService(attendanceStore, new RiskScoringEngine(), CLOCK);
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private AttritionReportService service(AttritionRiskService risk, Clock clock) {
        return new AttritionReportService(attendanceStore, reportStore, risk, pool, clock, 10);
    }

    private AttritionReportService service() {
        return service(riskService, CLOCK);
    }

    private void addEmployee(String employeeId, List<AttendanceStatus> statuses) {
        attendanceStore.addEmployee(employee(employeeId));
        attendanceStore.addRecords(records(employeeId, statuses));
    }

    private static List<AttendanceStatus> withAbsences(int total, int absentAtEnd) {
        List<AttendanceStatus> statuses = new ArrayList<>(statuses(total - absentAtEnd, PRESENT));
        statuses.addAll(statuses(absentAtEnd, ABSENT));
        return statuses;
    }

    @Nested
    @DisplayName("generateReport")
    class Generate {

        @Test
        void sortsByScoreDescendingAndSummarizes() {
            addEmployee("E1", statuses(60, PRESENT));
            addEmployee("E2", withAbsences(63, 14));
            addEmployee("E3", withAbsences(60, 3));
            attendanceStore.addEmployee(employee("E4"));

            CompanyRiskReport report = service().generateReport(ORG, 3);

            assertEquals(List.of("E2", "E3", "E1", "E4"),
                    report.getEmployees().stream().map(RiskAssessment::getEmployeeId).toList());
            assertEquals(RiskLevel.HIGH, report.getEmployees().get(0).getRiskLevel());
            assertEquals(4, report.getTotalEmployees());
            assertEquals(1, report.getSummary().getHigh());
            assertEquals(1, report.getSummary().getInsufficientData());
            assertEquals(3, report.getPeriod());
            assertEquals("3 months", report.getPeriodLabel());
            assertEquals(Instant.now(CLOCK), report.getGeneratedAt());
            assertEquals(ORG, report.getOrganizationId());
            assertNull(report.getId());
        }

        @Test
        @DisplayName("equal scores keep employee order regardless of completion order")
        void tiesAreStable() {
            for (int i = 1; i <= 20; i++) {
                addEmployee(String.format("E%02d", i), statuses(60, PRESENT));
            }

            List<String> expected = attendanceStore.findEmployees(ORG).stream().map(Employee::getEmployeeId).toList();
            for (int run = 0; run < 5; run++) {
                CompanyRiskReport report = service().generateReport(ORG, 3);
                assertEquals(expected, report.getEmployees().stream().map(RiskAssessment::getEmployeeId).toList());
            }
        }

        @Test
        @DisplayName("an employee that fails to score is left out, the rest still report")
        void failedEmployeeIsExcluded() {
            addEmployee("E1", statuses(60, PRESENT));
            addEmployee("E2", withAbsences(63, 14));
            addEmployee("E3", statuses(60, PRESENT));

            AttritionRiskService flaky = spy(riskService);
            doThrow(new IllegalStateException("corrupt record"))
                    .when(flaky).assess(argThat((Employee e) -> e != null && e.getEmployeeId().equals("E2")), anyInt());

            CompanyRiskReport report = service(flaky, CLOCK).generateReport(ORG, 3);

            assertEquals(List.of("E1", "E3"),
                    report.getEmployees().stream().map(RiskAssessment::getEmployeeId).toList());
            assertEquals(3, report.getTotalEmployees());
            assertEquals(0, report.getSummary().getHigh());
            assertEquals(2, report.getSummary().getLow());
        }

        @Test
        void noEmployeesGivesEmptyReport() {
            CompanyRiskReport report = service().generateReport(ORG, 3);

            assertTrue(report.getEmployees().isEmpty());
            assertEquals(0, report.getTotalEmployees());
            assertEquals(0, report.getSummary().getLow());
        }

        @Test
        void otherOrganizationsAreIgnored() {
            addEmployee("E1", statuses(60, PRESENT));
            Employee other = employee("X1");
            other.setOrganizationId("org-2");
            attendanceStore.addEmployee(other);

            assertEquals(1, service().generateReport(ORG, 3).getTotalEmployees());
        }

        @Test
        void monthsMustBePositive() {
            assertThrows(CustomException.class, () -> service().generateReport(ORG, 0));
        }
    }

    @Test
    void highRiskKeepsReportOrderAtOrAboveThreshold() {
        addEmployee("E1", statuses(60, PRESENT));
        addEmployee("E2", withAbsences(63, 14));
        addEmployee("E3", withAbsences(60, 3));

        AttritionReportService service = service();
        CompanyRiskReport report = service.generateReport(ORG, 3);

        assertEquals(List.of("E2"), service.highRisk(report, 70).stream().map(RiskAssessment::getEmployeeId).toList());
        assertEquals(3, service.highRisk(report, 0).size());

        double secondScore = report.getEmployees().get(1).getScore();
        assertEquals(List.of("E2", "E3"),
                service.highRisk(report, secondScore).stream().map(RiskAssessment::getEmployeeId).toList());
    }

    @Test
    void generateAndStoreReportPersists() {
        addEmployee("E1", statuses(60, PRESENT));

        CompanyRiskReport saved = service().generateAndStoreReport(ORG, 3);

        assertNotNull(saved.getId());
        assertEquals(List.of(saved), reportStore.all());
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        addEmployee("E1", statuses(60, PRESENT));
        Instant start = Instant.parse("2024-03-29T00:00:00Z");
        for (int i = 0; i < 12; i++) {
            Clock clock = Clock.fixed(start.plusSeconds(i * 60L), ZoneOffset.UTC);
            service(riskService, clock).generateAndStoreReport(ORG, 3);
        }

        List<CompanyRiskReport> history = service().history(ORG);

        assertEquals(10, history.size());
        assertEquals(start.plusSeconds(11 * 60L), history.get(0).getGeneratedAt());
        assertEquals(start.plusSeconds(2 * 60L), history.get(9).getGeneratedAt());
        assertTrue(service().history("org-2").isEmpty());
    }
}
