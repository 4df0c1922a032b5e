package com.example.Attrition.dto;

import com.example.Attrition.model.RiskAssessment;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class HighRiskResponse {
    private int count;
    private double threshold;
    private List<RiskAssessment> employees;
}
