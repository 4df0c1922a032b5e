package com.example.Attrition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of an organization's attrition risk at {@code generatedAt}. Employees are
 * ordered by score, highest first. Never modified once built; the store only assigns an id.
 */
@Value
@Builder
@AllArgsConstructor
@Document(collection = "attrition_reports")
public class CompanyRiskReport {
    @Id
    @With
    String id;
    @Indexed
    String organizationId;
    int period;
    String periodLabel;
    int totalEmployees;
    RiskSummary summary;
    @Singular
    List<RiskAssessment> employees;
    Instant generatedAt;
}
