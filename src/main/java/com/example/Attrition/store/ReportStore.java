package com.example.Attrition.store;

import com.example.Attrition.model.CompanyRiskReport;

import java.util.List;

public interface ReportStore {

    CompanyRiskReport save(CompanyRiskReport report);

    List<CompanyRiskReport> findRecent(String organizationId, int limit);
}
