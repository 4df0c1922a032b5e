package com.example.Attrition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * The four sub-scores behind a composite risk score, each in [0, 100].
 */
@Value
@Builder
@AllArgsConstructor
public class RiskFactorScores {
    double absenteeism;
    double leavePattern;
    double consistency;
    double recentTrend;
}
