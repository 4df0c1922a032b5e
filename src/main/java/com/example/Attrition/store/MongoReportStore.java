package com.example.Attrition.store;

import com.example.Attrition.model.CompanyRiskReport;
import com.example.Attrition.repository.AttritionReportRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class MongoReportStore implements ReportStore {

    private final AttritionReportRepository reportRepository;

    @Override
    public CompanyRiskReport save(CompanyRiskReport report) {
        return reportRepository.save(report);
    }

    @Override
    public List<CompanyRiskReport> findRecent(String organizationId, int limit) {
        return reportRepository.findByOrganizationIdOrderByGeneratedAtDesc(organizationId, PageRequest.of(0, limit));
    }
}
