package com.example.Attrition.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Result of scoring one employee over a lookback window. Factors and statistics are
 * absent when the level is {@link RiskLevel#INSUFFICIENT_DATA}.
 */
@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RiskAssessment {
    String employeeId;
    String name;
    String email;
    String department;
    double score;
    RiskLevel riskLevel;
    RiskFactorScores factors;
    AttendanceStatistics statistics;
    String recommendation;
}
