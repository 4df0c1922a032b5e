package com.example.Attrition.repository;

import com.example.Attrition.model.CompanyRiskReport;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AttritionReportRepository extends MongoRepository<CompanyRiskReport, String> {
    List<CompanyRiskReport> findByOrganizationIdOrderByGeneratedAtDesc(String organizationId, Pageable pageable);
}
