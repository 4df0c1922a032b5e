package com.example.Attrition.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    HIGH("High", "URGENT: Schedule immediate 1-on-1 meeting. Investigate causes of absenteeism. Consider retention strategies."),
    MODERATE("Moderate", "MONITOR: Regular check-ins recommended. Address any workplace concerns proactively."),
    LOW("Low", "LOW RISK: Continue standard engagement practices. Employee shows stable attendance."),
    INSUFFICIENT_DATA("Insufficient Data", "Need at least 3 months of attendance data");

    private final String label;
    private final String recommendation;

    RiskLevel(String label, String recommendation) {
        this.label = label;
        this.recommendation = recommendation;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public String getRecommendation() {
        return recommendation;
    }

    /**
     * Bands are inclusive at their lower bound: 70 is High, 40 is Moderate.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= 70) return HIGH;
        if (score >= 40) return MODERATE;
        return LOW;
    }
}
