package com.example.Attrition.controller;

import com.example.Attrition.dto.HighRiskResponse;
import com.example.Attrition.model.CompanyRiskReport;
import com.example.Attrition.model.RiskAssessment;
import com.example.Attrition.service.AttritionReportService;
import com.example.Attrition.service.AttritionRiskService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.Attrition.controller.AttendanceController.ORGANIZATION_HEADER;

@RestController
@RequestMapping("/api/attrition")
@CrossOrigin(origins = "${attrition.frontend-url}", allowCredentials = "true")
@RequiredArgsConstructor
public class AttritionController {

    private final AttritionReportService reportService;
    private final AttritionRiskService riskService;

    @GetMapping("/report")
    public ResponseEntity<Map<String, Object>> generateReport(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                                              @RequestParam(defaultValue = "3") int months) {
        CompanyRiskReport report = reportService.generateAndStoreReport(organizationId, months);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Attrition report generated successfully");
        body.put("reportId", report.getId());
        body.put("report", report);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/employee/{employeeId}")
    public ResponseEntity<Map<String, RiskAssessment>> getEmployeeRisk(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                                                       @PathVariable String employeeId,
                                                                       @RequestParam(defaultValue = "3") int months) {
        return ResponseEntity.ok(Map.of("risk", riskService.assess(organizationId, employeeId, months)));
    }

    // fresh report, not stored
    @GetMapping("/high-risk")
    public ResponseEntity<HighRiskResponse> getHighRisk(@RequestHeader(ORGANIZATION_HEADER) String organizationId,
                                                        @RequestParam(defaultValue = "3") int months,
                                                        @RequestParam(defaultValue = "70") double threshold) {
        CompanyRiskReport report = reportService.generateReport(organizationId, months);
        List<RiskAssessment> employees = reportService.highRisk(report, threshold);
        return ResponseEntity.ok(new HighRiskResponse(employees.size(), threshold, employees));
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, List<CompanyRiskReport>>> getHistory(@RequestHeader(ORGANIZATION_HEADER) String organizationId) {
        return ResponseEntity.ok(Map.of("reports", reportService.history(organizationId)));
    }
}
